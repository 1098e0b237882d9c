package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.StructType;
import com.matrixlang.compiler.analysis.types.TypeScheme;
import com.matrixlang.compiler.analysis.types.TypeVariable;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 类型环境：名字到方案的映射，带父链
 *
 * <p>子环境只向自身添加绑定，不修改父环境。根环境在找不到名字时回退到内置签名表。
 * 结构体、类型类、实例和模块与值绑定一样按作用域分层。</p>
 */
public final class TypeEnvironment {

    /** 值绑定：方案 + 是否可重新赋值 */
    public static final class Binding {
        private final TypeScheme scheme;
        private final boolean mutable;

        public Binding(TypeScheme scheme, boolean mutable) {
            this.scheme = scheme;
            this.mutable = mutable;
        }

        public TypeScheme getScheme() {
            return scheme;
        }

        public boolean isMutable() {
            return mutable;
        }
    }

    private final TypeEnvironment parent;
    private final SignatureTable signatures;
    private final Map<String, Binding> values = new LinkedHashMap<String, Binding>();
    private final Map<String, StructType> structs = new LinkedHashMap<String, StructType>();
    private final Map<String, TypeclassInfo> typeclasses = new LinkedHashMap<String, TypeclassInfo>();
    private final Set<String> instances = new HashSet<String>();
    private final Map<String, ModuleInfo> modules = new LinkedHashMap<String, ModuleInfo>();

    /** 根环境 */
    public TypeEnvironment(SignatureTable signatures) {
        this(null, signatures);
    }

    private TypeEnvironment(TypeEnvironment parent, SignatureTable signatures) {
        this.parent = parent;
        this.signatures = signatures;
    }

    public TypeEnvironment child() {
        return new TypeEnvironment(this, signatures);
    }

    public TypeEnvironment getParent() {
        return parent;
    }

    // ============ 值 ============

    public void define(String name, TypeScheme scheme, boolean mutable) {
        values.put(name, new Binding(scheme, mutable));
    }

    /** 由内向外查找；用户绑定遮蔽内置名字 */
    public Binding lookup(String name) {
        for (TypeEnvironment env = this; env != null; env = env.parent) {
            Binding b = env.values.get(name);
            if (b != null) return b;
        }
        TypeScheme builtin = signatures.lookupSignature(name);
        return builtin != null ? new Binding(builtin, false) : null;
    }

    /** 本层定义的值绑定 */
    public Map<String, Binding> getLocalBindings() {
        return Collections.unmodifiableMap(values);
    }

    /** 所有可见的用户绑定（内层覆盖外层） */
    public Map<String, Binding> getVisibleBindings() {
        Map<String, Binding> all = parent != null
                ? new LinkedHashMap<String, Binding>(parent.getVisibleBindings())
                : new LinkedHashMap<String, Binding>();
        all.putAll(values);
        return all;
    }

    /**
     * 环境中自由的类型变量：各层绑定方案体中未被量化的变量（内置方案是封闭的，不参与）
     */
    public Set<Integer> freeTypeVariables(TypeUnifier unifier) {
        Set<Integer> result = new HashSet<Integer>();
        for (TypeEnvironment env = this; env != null; env = env.parent) {
            for (Binding b : env.values.values()) {
                Set<Integer> free = unifier.freeVariables(b.getScheme().getBody());
                for (TypeVariable q : b.getScheme().getQuantified()) {
                    free.remove(q.getId());
                }
                result.addAll(free);
            }
        }
        return result;
    }

    // ============ 结构体 / 类型类 / 实例 / 模块 ============

    public void defineStruct(StructType struct) {
        structs.put(struct.getName(), struct);
    }

    public StructType lookupStruct(String name) {
        for (TypeEnvironment env = this; env != null; env = env.parent) {
            StructType s = env.structs.get(name);
            if (s != null) return s;
        }
        return null;
    }

    /** 所有可见结构体（用于按字段名反查） */
    public Map<String, StructType> getVisibleStructs() {
        Map<String, StructType> all = parent != null
                ? new LinkedHashMap<String, StructType>(parent.getVisibleStructs())
                : new LinkedHashMap<String, StructType>();
        all.putAll(structs);
        return all;
    }

    public void defineTypeclass(TypeclassInfo info) {
        typeclasses.put(info.getName(), info);
    }

    public TypeclassInfo lookupTypeclass(String name) {
        for (TypeEnvironment env = this; env != null; env = env.parent) {
            TypeclassInfo t = env.typeclasses.get(name);
            if (t != null) return t;
        }
        return null;
    }

    public void addInstance(String typeclassName, String headName) {
        instances.add(typeclassName + ":" + headName);
    }

    public boolean hasInstance(String typeclassName, String headName) {
        String key = typeclassName + ":" + headName;
        for (TypeEnvironment env = this; env != null; env = env.parent) {
            if (env.instances.contains(key)) return true;
        }
        return false;
    }

    public void defineModule(ModuleInfo module) {
        modules.put(module.getName(), module);
    }

    public ModuleInfo lookupModule(String name) {
        for (TypeEnvironment env = this; env != null; env = env.parent) {
            ModuleInfo m = env.modules.get(name);
            if (m != null) return m;
        }
        return null;
    }
}
