package com.matrixlang.compiler.ast.pattern;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

/**
 * 绑定模式：匹配任意值并绑定到名字
 */
public final class BindingPattern extends Pattern {
    private final String name;

    public BindingPattern(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBindingPattern(this, context);
    }
}
