package com.matrixlang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 类型方案：∀ 量化变量 [约束]. 类型体
 */
public final class TypeScheme {

    private final List<TypeVariable> quantified;
    private final Map<Integer, TypeConstraint> constraints;
    private final MxType body;

    public TypeScheme(List<TypeVariable> quantified, Map<Integer, TypeConstraint> constraints, MxType body) {
        this.quantified = Collections.unmodifiableList(quantified);
        this.constraints = Collections.unmodifiableMap(constraints);
        this.body = body;
    }

    /** 不含量化变量的单态方案 */
    public static TypeScheme mono(MxType type) {
        return new TypeScheme(Collections.<TypeVariable>emptyList(),
                Collections.<Integer, TypeConstraint>emptyMap(), type);
    }

    public List<TypeVariable> getQuantified() {
        return quantified;
    }

    public boolean isPolymorphic() {
        return !quantified.isEmpty();
    }

    public TypeConstraint getConstraint(int variableId) {
        TypeConstraint c = constraints.get(variableId);
        return c != null ? c : TypeConstraint.NONE;
    }

    public MxType getBody() {
        return body;
    }

    /** 函数方案的参数个数；非函数返回 -1 */
    public int getArity() {
        return body instanceof FunctionType ? ((FunctionType) body).getArity() : -1;
    }

    public String toDisplayString() {
        Map<Integer, String> names = new HashMap<Integer, String>();
        for (int i = 0; i < quantified.size(); i++) {
            names.put(quantified.get(i).getId(), TypePrinter.letterName(i));
        }
        List<String> prefix = new ArrayList<String>();
        for (TypeVariable var : quantified) {
            TypeConstraint c = getConstraint(var.getId());
            if (!c.isNone()) prefix.add(c.describeFor(names.get(var.getId())));
        }
        String bodyText = new TypePrinter(names).print(body);
        if (prefix.isEmpty()) return bodyText;
        return String.join(", ", prefix) + " => " + bodyText;
    }

    /** 按 id 索引的约束副本 */
    public Map<Integer, TypeConstraint> getConstraints() {
        return new LinkedHashMap<Integer, TypeConstraint>(constraints);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
