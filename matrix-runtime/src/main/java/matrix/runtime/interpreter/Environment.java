package matrix.runtime.interpreter;

import com.matrixlang.compiler.ast.SourceLocation;
import matrix.runtime.MxModule;
import matrix.runtime.MxRuntimeException;
import matrix.runtime.MxValue;
import matrix.runtime.RuntimeErrorKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行时环境（作用域帧）
 *
 * <p>绑定只追加不覆盖：同名的后一个绑定遮蔽前一个。子帧记住创建时父帧的绑定数，
 * 查找父帧时只看这之前的绑定，因此闭包看到的永远是定义点的词法作用域，
 * 即使父帧之后又遮蔽了同名绑定。</p>
 */
public final class Environment {

    private static final int INITIAL_CAPACITY = 4;

    private final Environment parent;
    /** 父帧中对本帧可见的绑定数 */
    private final int parentLimit;
    private String[] keys;
    private MxValue[] vals;
    private boolean[] mutable;
    private int size;

    // 模块与结构体按名字查找，不受可见绑定数限制
    private Map<String, MxModule> modules;
    private Map<String, StructDefinition> structs;

    /**
     * 创建顶层环境
     */
    public Environment() {
        this(null, 0);
    }

    private Environment(Environment parent, int parentLimit) {
        this.parent = parent;
        this.parentLimit = parentLimit;
        this.keys = new String[INITIAL_CAPACITY];
        this.vals = new MxValue[INITIAL_CAPACITY];
        this.mutable = new boolean[INITIAL_CAPACITY];
    }

    /**
     * 子帧：看到本帧此刻已有的绑定
     */
    public Environment child() {
        return new Environment(this, size);
    }

    public Environment getParent() {
        return parent;
    }

    public int size() {
        return size;
    }

    private void ensureCapacity() {
        if (size == keys.length) {
            int newCap = keys.length < 16 ? keys.length + 4 : keys.length * 2;
            keys = Arrays.copyOf(keys, newCap);
            vals = Arrays.copyOf(vals, newCap);
            mutable = Arrays.copyOf(mutable, newCap);
        }
    }

    /**
     * 定义绑定，返回槽位下标
     */
    public int define(String name, MxValue value, boolean isMutable) {
        ensureCapacity();
        keys[size] = name;
        vals[size] = value;
        mutable[size] = isMutable;
        return size++;
    }

    /**
     * 两阶段绑定的第一步：先占住槽位，值稍后由 {@link #fill} 填入
     */
    public int definePlaceholder(String name) {
        return define(name, null, false);
    }

    public void fill(int slot, MxValue value) {
        vals[slot] = value;
    }

    /** 从 limit 之前往回找 name 的槽位 */
    private int indexOf(String name, int limit) {
        for (int i = limit - 1; i >= 0; i--) {
            if (name.equals(keys[i])) return i;
        }
        return -1;
    }

    /**
     * 查找变量；未定义（或占位尚未填入）时返回 null
     */
    public MxValue lookup(String name) {
        Environment env = this;
        int limit = size;
        while (env != null) {
            int idx = env.indexOf(name, limit);
            if (idx >= 0) return env.vals[idx];
            limit = env.parentLimit;
            env = env.parent;
        }
        return null;
    }

    /**
     * 给可变绑定赋值
     *
     * @param journal 记录旧值以便回滚，可为 null
     */
    public void assign(String name, MxValue value, AssignmentJournal journal, SourceLocation location) {
        Environment env = this;
        int limit = size;
        while (env != null) {
            int idx = env.indexOf(name, limit);
            if (idx >= 0) {
                if (!env.mutable[idx]) {
                    throw new MxRuntimeException(RuntimeErrorKind.ImmutableAssignment,
                            "cannot assign to immutable binding '" + name + "'", location, name);
                }
                if (journal != null) journal.record(env, idx, env.vals[idx]);
                env.vals[idx] = value;
                return;
            }
            limit = env.parentLimit;
            env = env.parent;
        }
        throw MxRuntimeException.undefinedVariable(name, location);
    }

    /** 回滚时恢复槽位的旧值 */
    void restore(int slot, MxValue value) {
        vals[slot] = value;
    }

    /**
     * 本帧的绑定（同名取最后一个）
     */
    public Map<String, MxValue> getLocalBindings() {
        Map<String, MxValue> result = new LinkedHashMap<String, MxValue>();
        for (int i = 0; i < size; i++) {
            if (vals[i] != null) {
                result.remove(keys[i]);
                result.put(keys[i], vals[i]);
            }
        }
        return result;
    }

    /**
     * 从本帧可见的全部绑定，外层在前、遮蔽者优先
     */
    public Map<String, MxValue> getVisibleBindings() {
        List<Environment> chain = new ArrayList<Environment>();
        List<Integer> limits = new ArrayList<Integer>();
        Environment env = this;
        int limit = size;
        while (env != null) {
            chain.add(env);
            limits.add(limit);
            limit = env.parentLimit;
            env = env.parent;
        }
        Collections.reverse(chain);
        Collections.reverse(limits);
        Map<String, MxValue> result = new LinkedHashMap<String, MxValue>();
        for (int f = 0; f < chain.size(); f++) {
            Environment frame = chain.get(f);
            for (int i = 0; i < limits.get(f); i++) {
                if (frame.vals[i] == null) continue;
                result.remove(frame.keys[i]);
                result.put(frame.keys[i], frame.vals[i]);
            }
        }
        return result;
    }

    // ============ 模块与结构体 ============

    public void defineModule(MxModule module) {
        if (modules == null) modules = new HashMap<String, MxModule>();
        modules.put(module.getName(), module);
    }

    public MxModule lookupModule(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.modules != null && env.modules.containsKey(name)) return env.modules.get(name);
        }
        return null;
    }

    public void defineStruct(StructDefinition struct) {
        if (structs == null) structs = new HashMap<String, StructDefinition>();
        structs.put(struct.getName(), struct);
    }

    public StructDefinition lookupStruct(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.structs != null && env.structs.containsKey(name)) return env.structs.get(name);
        }
        return null;
    }
}
