package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 模式匹配表达式（不检查穷尽性）
 */
public final class MatchExpr extends Expression {
    private final Expression scrutinee;
    private final List<MatchArm> arms;

    public MatchExpr(SourceLocation location, Expression scrutinee, List<MatchArm> arms) {
        super(location);
        this.scrutinee = scrutinee;
        this.arms = arms;
    }

    public Expression getScrutinee() {
        return scrutinee;
    }

    public List<MatchArm> getArms() {
        return arms;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMatchExpr(this, context);
    }
}
