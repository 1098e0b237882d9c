package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

/**
 * {@code spawn expr}：立即求值并包装为任务句柄
 */
public final class SpawnExpr extends Expression {
    private final Expression body;

    public SpawnExpr(SourceLocation location, Expression body) {
        super(location);
        this.body = body;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSpawnExpr(this, context);
    }
}
