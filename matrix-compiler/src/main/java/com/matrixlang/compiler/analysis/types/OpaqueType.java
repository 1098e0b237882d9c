package com.matrixlang.compiler.analysis.types;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 不透明句柄类型：Task&lt;T&gt;（spawn 的结果）以及外部协作者对象（PhysicsWorld、QuantumCircuit）
 */
public final class OpaqueType extends MxType {

    public static final String TASK = "Task";
    public static final String PHYSICS_WORLD = "PhysicsWorld";
    public static final String QUANTUM_CIRCUIT = "QuantumCircuit";

    // 已知句柄类型名 -> 类型参数个数
    private static final Map<String, Integer> KNOWN;

    static {
        Map<String, Integer> map = new HashMap<String, Integer>();
        map.put(TASK, 1);
        map.put(PHYSICS_WORLD, 0);
        map.put(QUANTUM_CIRCUIT, 0);
        KNOWN = Collections.unmodifiableMap(map);
    }

    private final String name;
    private final List<MxType> typeArgs;

    public OpaqueType(String name, List<MxType> typeArgs) {
        this.name = name;
        this.typeArgs = Collections.unmodifiableList(typeArgs);
    }

    public OpaqueType(String name) {
        this(name, Collections.<MxType>emptyList());
    }

    public static OpaqueType task(MxType result) {
        return new OpaqueType(TASK, Collections.singletonList(result));
    }

    /** 已知句柄类型的类型参数个数；未知名称返回 -1 */
    public static int arityOf(String name) {
        Integer arity = KNOWN.get(name);
        return arity != null ? arity : -1;
    }

    public String getName() {
        return name;
    }

    public List<MxType> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public String getHeadName() {
        return name;
    }

    @Override
    public <R> R accept(MxTypeVisitor<R> visitor) {
        return visitor.visitOpaque(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OpaqueType)) return false;
        OpaqueType that = (OpaqueType) o;
        return name.equals(that.name) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeArgs);
    }
}
