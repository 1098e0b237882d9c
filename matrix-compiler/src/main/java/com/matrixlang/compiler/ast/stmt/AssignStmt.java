package com.matrixlang.compiler.ast.stmt;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.expr.Expression;

/**
 * 赋值语句 {@code x = e}（仅限 let mut 绑定）
 */
public final class AssignStmt extends Statement {
    private final String name;
    private final Expression value;

    public AssignStmt(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
