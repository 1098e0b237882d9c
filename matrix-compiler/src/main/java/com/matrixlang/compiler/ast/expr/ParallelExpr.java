package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * {@code parallel { a; b }}：在当前帧内按顺序求值
 */
public final class ParallelExpr extends Expression {
    private final List<Statement> statements;

    public ParallelExpr(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParallelExpr(this, context);
    }
}
