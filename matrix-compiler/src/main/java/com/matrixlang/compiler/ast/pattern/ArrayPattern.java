package com.matrixlang.compiler.ast.pattern;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 数组模式 {@code [a, b, _]}（长度必须一致）
 */
public final class ArrayPattern extends Pattern {
    private final List<Pattern> elements;

    public ArrayPattern(SourceLocation location, List<Pattern> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Pattern> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayPattern(this, context);
    }
}
