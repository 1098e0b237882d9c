package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstNode;
import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

/**
 * 推导式子句：生成器 {@code x in xs}（variable 非 null）或过滤条件
 */
public final class ComprehensionClause extends AstNode {
    private final String variable;  // 过滤子句为 null
    private final Expression expression;

    public ComprehensionClause(SourceLocation location, String variable, Expression expression) {
        super(location);
        this.variable = variable;
        this.expression = expression;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getExpression() {
        return expression;
    }

    public boolean isGenerator() {
        return variable != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComprehensionClause(this, context);
    }
}
