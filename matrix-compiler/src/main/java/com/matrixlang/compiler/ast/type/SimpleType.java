package com.matrixlang.compiler.ast.type;

import com.matrixlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 具名类型：{@code Int}、{@code Point}、{@code Matrix<Float>}；小写单名为类型变量
 */
public final class SimpleType extends TypeRef {
    private final String name;
    private final List<TypeRef> typeArgs;

    public SimpleType(SourceLocation location, String name, List<TypeRef> typeArgs) {
        super(location);
        this.name = name;
        this.typeArgs = typeArgs != null ? typeArgs : Collections.<TypeRef>emptyList();
    }

    public SimpleType(SourceLocation location, String name) {
        this(location, name, null);
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    /** 以小写字母开头的名字是类型变量 */
    public boolean isTypeVariable() {
        return !name.isEmpty() && Character.isLowerCase(name.charAt(0)) && typeArgs.isEmpty();
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitSimple(this);
    }
}
