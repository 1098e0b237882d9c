package com.matrixlang.compiler.analysis.types;

/**
 * 矩阵类型 Matrix&lt;T&gt;（T 为 Int 或 Float）
 */
public final class MatrixType extends MxType {

    private final MxType elementType;

    public MatrixType(MxType elementType) {
        this.elementType = elementType;
    }

    public MxType getElementType() {
        return elementType;
    }

    @Override
    public String getHeadName() {
        return "Matrix";
    }

    @Override
    public <R> R accept(MxTypeVisitor<R> visitor) {
        return visitor.visitMatrix(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatrixType)) return false;
        return elementType.equals(((MatrixType) o).elementType);
    }

    @Override
    public int hashCode() {
        return 31 * elementType.hashCode() + 2;
    }
}
