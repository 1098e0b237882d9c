package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 块表达式 {@code { stmt; stmt; expr }}
 *
 * <p>值为最后的尾表达式；没有尾表达式时为 Unit。</p>
 */
public final class BlockExpr extends Expression {
    private final List<Statement> statements;
    private final Expression trailing;  // 可为 null

    public BlockExpr(SourceLocation location, List<Statement> statements, Expression trailing) {
        super(location);
        this.statements = statements;
        this.trailing = trailing;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public Expression getTrailing() {
        return trailing;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlockExpr(this, context);
    }
}
