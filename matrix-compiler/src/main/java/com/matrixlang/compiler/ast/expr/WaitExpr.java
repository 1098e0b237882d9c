package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

/**
 * {@code wait h} / {@code wait [h1, h2]}：取出已完成任务的结果
 */
public final class WaitExpr extends Expression {
    private final Expression target;

    public WaitExpr(SourceLocation location, Expression target) {
        super(location);
        this.target = target;
    }

    public Expression getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWaitExpr(this, context);
    }
}
