package com.matrixlang.compiler.ast.pattern;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

/**
 * 通配模式 {@code _}
 */
public final class WildcardPattern extends Pattern {
    public WildcardPattern(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWildcardPattern(this, context);
    }
}
