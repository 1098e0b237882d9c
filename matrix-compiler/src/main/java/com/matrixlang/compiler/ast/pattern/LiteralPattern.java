package com.matrixlang.compiler.ast.pattern;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.expr.Literal;

/**
 * 字面量模式
 */
public final class LiteralPattern extends Pattern {
    private final Literal literal;

    public LiteralPattern(SourceLocation location, Literal literal) {
        super(location);
        this.literal = literal;
    }

    public Literal getLiteral() {
        return literal;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteralPattern(this, context);
    }
}
