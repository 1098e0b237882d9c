package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

/**
 * 字段访问 {@code target.field}（也用于模块成员访问）
 */
public final class FieldAccessExpr extends Expression {
    private final Expression target;
    private final String field;

    public FieldAccessExpr(SourceLocation location, Expression target, String field) {
        super(location);
        this.target = target;
        this.field = field;
    }

    public Expression getTarget() {
        return target;
    }

    public String getField() {
        return field;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldAccessExpr(this, context);
    }
}
