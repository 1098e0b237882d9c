package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstNode;
import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

/**
 * 结构体字面量中的字段初始化 {@code name: value}
 */
public final class FieldInit extends AstNode {
    private final String name;
    private final Expression value;

    public FieldInit(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldInit(this, context);
    }
}
