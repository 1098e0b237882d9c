package matrix.runtime.interpreter;

import matrix.runtime.MxValue;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 类型类实例的方法表：类型类 → 类型头名 → 方法名 → 实现
 *
 * <p>实例在整个会话内可见，与检查器登记实例的方式一致；REPL 输入失败时整体恢复到快照。</p>
 */
final class InstanceTable {

    private Map<String, Map<String, Map<String, MxValue>>> instances =
            new HashMap<String, Map<String, Map<String, MxValue>>>();

    void define(String typeclass, String head, String method, MxValue implementation) {
        Map<String, Map<String, MxValue>> byHead = instances.get(typeclass);
        if (byHead == null) {
            byHead = new LinkedHashMap<String, Map<String, MxValue>>();
            instances.put(typeclass, byHead);
        }
        Map<String, MxValue> methods = byHead.get(head);
        if (methods == null) {
            methods = new HashMap<String, MxValue>();
            byHead.put(head, methods);
        }
        methods.put(method, implementation);
    }

    MxValue lookup(String typeclass, String head, String method) {
        Map<String, Map<String, MxValue>> byHead = instances.get(typeclass);
        if (byHead == null) return null;
        Map<String, MxValue> methods = byHead.get(head);
        return methods != null ? methods.get(method) : null;
    }

    /** 某类型类的全部实例头名，按登记顺序 */
    Iterable<String> heads(String typeclass) {
        Map<String, Map<String, MxValue>> byHead = instances.get(typeclass);
        return byHead != null ? byHead.keySet() : new LinkedHashMap<String, Object>().keySet();
    }

    int instanceCount(String typeclass) {
        Map<String, Map<String, MxValue>> byHead = instances.get(typeclass);
        return byHead != null ? byHead.size() : 0;
    }

    Map<String, Map<String, Map<String, MxValue>>> snapshot() {
        Map<String, Map<String, Map<String, MxValue>>> copy = new HashMap<String, Map<String, Map<String, MxValue>>>();
        for (Map.Entry<String, Map<String, Map<String, MxValue>>> e : instances.entrySet()) {
            Map<String, Map<String, MxValue>> byHead = new LinkedHashMap<String, Map<String, MxValue>>();
            for (Map.Entry<String, Map<String, MxValue>> h : e.getValue().entrySet()) {
                byHead.put(h.getKey(), new HashMap<String, MxValue>(h.getValue()));
            }
            copy.put(e.getKey(), byHead);
        }
        return copy;
    }

    void restore(Map<String, Map<String, Map<String, MxValue>>> snapshot) {
        this.instances = snapshot;
    }
}
