package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 数组推导式 {@code [x * 2 | x in xs, x > 1]}
 */
public final class ComprehensionExpr extends Expression {
    private final Expression element;
    private final List<ComprehensionClause> clauses;

    public ComprehensionExpr(SourceLocation location, Expression element, List<ComprehensionClause> clauses) {
        super(location);
        this.element = element;
        this.clauses = clauses;
    }

    public Expression getElement() {
        return element;
    }

    public List<ComprehensionClause> getClauses() {
        return clauses;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComprehensionExpr(this, context);
    }
}
