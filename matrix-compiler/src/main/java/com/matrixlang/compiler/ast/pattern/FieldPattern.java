package com.matrixlang.compiler.ast.pattern;

import com.matrixlang.compiler.ast.AstNode;
import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

/**
 * 结构体模式中的字段子模式
 */
public final class FieldPattern extends AstNode {
    private final String name;
    private final Pattern pattern;

    public FieldPattern(SourceLocation location, String name, Pattern pattern) {
        super(location);
        this.name = name;
        this.pattern = pattern;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldPattern(this, context);
    }
}
