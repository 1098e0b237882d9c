package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 按映射替换类型变量
 *
 * <p>recursive 为 true 时对替换结果继续解析（用于合一器的绑定链），
 * 为 false 时只替换一次（用于方案实例化，避免新变量 id 与量化变量 id 重叠时串联替换）。</p>
 */
final class TypeSubstitution implements MxTypeVisitor<MxType> {

    private final Map<Integer, MxType> mapping;
    private final boolean recursive;

    TypeSubstitution(Map<Integer, MxType> mapping, boolean recursive) {
        this.mapping = mapping;
        this.recursive = recursive;
    }

    MxType apply(MxType type) {
        return type.accept(this);
    }

    @Override
    public MxType visitPrimitive(PrimitiveType type) {
        return type;
    }

    @Override
    public MxType visitArray(ArrayType type) {
        return new ArrayType(apply(type.getElementType()));
    }

    @Override
    public MxType visitMatrix(MatrixType type) {
        return new MatrixType(apply(type.getElementType()));
    }

    @Override
    public MxType visitFunction(FunctionType type) {
        return new FunctionType(applyAll(type.getParamTypes()), apply(type.getReturnType()));
    }

    @Override
    public MxType visitStruct(StructType type) {
        return type;
    }

    @Override
    public MxType visitOpaque(OpaqueType type) {
        if (type.getTypeArgs().isEmpty()) return type;
        return new OpaqueType(type.getName(), applyAll(type.getTypeArgs()));
    }

    @Override
    public MxType visitVariable(TypeVariable type) {
        MxType bound = mapping.get(type.getId());
        if (bound == null) return type;
        return recursive ? apply(bound) : bound;
    }

    private List<MxType> applyAll(List<MxType> types) {
        List<MxType> result = new ArrayList<MxType>(types.size());
        for (MxType t : types) {
            result.add(apply(t));
        }
        return result;
    }
}
