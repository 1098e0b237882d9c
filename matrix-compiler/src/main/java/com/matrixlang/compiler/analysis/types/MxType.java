package com.matrixlang.compiler.analysis.types;

/**
 * 结构化类型表示基类
 */
public abstract class MxType {

    /**
     * 类型头名称，用于类型类实例查找（如 "Int"、"Array"、"Point"）；类型变量返回 null
     */
    public abstract String getHeadName();

    /** 人类可读的类型名，用于诊断消息 */
    public String toDisplayString() {
        return new TypePrinter().print(this);
    }

    /** 接受 MxTypeVisitor 进行类型分派 */
    public abstract <R> R accept(MxTypeVisitor<R> visitor);

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
