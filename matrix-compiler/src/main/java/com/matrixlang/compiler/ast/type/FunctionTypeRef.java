package com.matrixlang.compiler.ast.type;

import com.matrixlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数类型 {@code (A, B) -> C}
 */
public final class FunctionTypeRef extends TypeRef {
    private final List<TypeRef> paramTypes;
    private final TypeRef returnType;

    public FunctionTypeRef(SourceLocation location, List<TypeRef> paramTypes, TypeRef returnType) {
        super(location);
        this.paramTypes = paramTypes;
        this.returnType = returnType;
    }

    public List<TypeRef> getParamTypes() {
        return paramTypes;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
