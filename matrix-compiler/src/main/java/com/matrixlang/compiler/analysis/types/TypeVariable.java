package com.matrixlang.compiler.analysis.types;

/**
 * 类型变量，按 id 比较。id 由所属检查会话的计数器分配。
 */
public final class TypeVariable extends MxType {

    private final int id;

    public TypeVariable(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public String getHeadName() {
        return null;
    }

    @Override
    public <R> R accept(MxTypeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeVariable)) return false;
        return id == ((TypeVariable) o).id;
    }

    @Override
    public int hashCode() {
        return id;
    }
}
