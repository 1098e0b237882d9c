package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.TypeScheme;
import com.matrixlang.compiler.ast.type.FunctionTypeRef;
import com.matrixlang.compiler.ast.type.SimpleType;
import com.matrixlang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 已声明的类型类：方法方案，以及每个方法用于运行时分派的参数位置
 */
public final class TypeclassInfo {

    private final String name;
    private final String typeParameter;
    private final Map<String, TypeScheme> methods = new LinkedHashMap<String, TypeScheme>();
    private final Map<String, Integer> dispatchIndex = new LinkedHashMap<String, Integer>();

    public TypeclassInfo(String name, String typeParameter) {
        this.name = name;
        this.typeParameter = typeParameter;
    }

    public String getName() {
        return name;
    }

    public String getTypeParameter() {
        return typeParameter;
    }

    /**
     * @param dispatch 类型为类型参数的第一个形参下标；没有时为 -1（只能按返回类型分派，不支持）
     */
    public void addMethod(String method, TypeScheme scheme, int dispatch) {
        methods.put(method, scheme);
        dispatchIndex.put(method, dispatch);
    }

    public Map<String, TypeScheme> getMethods() {
        return Collections.unmodifiableMap(methods);
    }

    public int getDispatchIndex(String method) {
        Integer index = dispatchIndex.get(method);
        return index != null ? index : -1;
    }

    /**
     * 方法签名中第一个类型恰为类参数的形参下标；签名不是函数或没有这样的形参时返回 -1
     */
    public static int dispatchIndexOf(TypeRef methodType, String typeParameter) {
        if (!(methodType instanceof FunctionTypeRef)) return -1;
        List<TypeRef> params = ((FunctionTypeRef) methodType).getParamTypes();
        for (int i = 0; i < params.size(); i++) {
            TypeRef p = params.get(i);
            if (p instanceof SimpleType && ((SimpleType) p).getName().equals(typeParameter)
                    && ((SimpleType) p).getTypeArgs().isEmpty()) {
                return i;
            }
        }
        return -1;
    }
}
