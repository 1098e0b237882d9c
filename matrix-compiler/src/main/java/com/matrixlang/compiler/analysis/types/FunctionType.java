package com.matrixlang.compiler.analysis.types;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数类型 (P1, P2) -> R
 */
public final class FunctionType extends MxType {

    private final List<MxType> paramTypes;
    private final MxType returnType;

    public FunctionType(List<MxType> paramTypes, MxType returnType) {
        this.paramTypes = Collections.unmodifiableList(paramTypes);
        this.returnType = returnType;
    }

    public List<MxType> getParamTypes() {
        return paramTypes;
    }

    public MxType getReturnType() {
        return returnType;
    }

    public int getArity() {
        return paramTypes.size();
    }

    @Override
    public String getHeadName() {
        return "Function";
    }

    @Override
    public <R> R accept(MxTypeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionType)) return false;
        FunctionType that = (FunctionType) o;
        return paramTypes.equals(that.paramTypes) && returnType.equals(that.returnType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(paramTypes, returnType);
    }
}
