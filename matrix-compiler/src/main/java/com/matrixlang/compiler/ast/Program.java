package com.matrixlang.compiler.ast;

import com.matrixlang.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 程序（编译单元）：顶层语句序列
 */
public final class Program extends AstNode {
    private final List<Statement> statements;

    public Program(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
