package com.matrixlang.compiler.ast.type;

import com.matrixlang.compiler.ast.SourceLocation;

/**
 * 数组类型简写 {@code [T]}
 */
public final class ArrayTypeRef extends TypeRef {
    private final TypeRef elementType;

    public ArrayTypeRef(SourceLocation location, TypeRef elementType) {
        super(location);
        this.elementType = elementType;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}
