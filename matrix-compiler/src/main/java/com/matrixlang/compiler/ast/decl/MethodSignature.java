package com.matrixlang.compiler.ast.decl;

import com.matrixlang.compiler.ast.AstNode;
import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.type.TypeRef;

/**
 * 类型类方法签名 {@code show: (T) -> String}
 */
public final class MethodSignature extends AstNode {
    private final String name;
    private final TypeRef type;

    public MethodSignature(SourceLocation location, String name, TypeRef type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodSignature(this, context);
    }
}
