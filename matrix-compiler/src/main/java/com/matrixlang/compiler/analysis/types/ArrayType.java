package com.matrixlang.compiler.analysis.types;

/**
 * 数组类型 [T]
 */
public final class ArrayType extends MxType {

    private final MxType elementType;

    public ArrayType(MxType elementType) {
        this.elementType = elementType;
    }

    public MxType getElementType() {
        return elementType;
    }

    @Override
    public String getHeadName() {
        return "Array";
    }

    @Override
    public <R> R accept(MxTypeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType)) return false;
        return elementType.equals(((ArrayType) o).elementType);
    }

    @Override
    public int hashCode() {
        return 31 * elementType.hashCode() + 1;
    }
}
