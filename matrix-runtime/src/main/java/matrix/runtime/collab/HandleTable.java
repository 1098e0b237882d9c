package matrix.runtime.collab;

import matrix.runtime.MxHandle;
import matrix.runtime.MxRuntimeException;
import matrix.runtime.MxValue;
import matrix.runtime.RuntimeErrorKind;

import java.util.HashMap;
import java.util.Map;

/**
 * 会话内的句柄表：句柄 id → 外部协作者对象
 *
 * <p>id 在会话内单调递增，从不复用。</p>
 */
public final class HandleTable {

    private final Map<Long, Object> objects = new HashMap<Long, Object>();
    private long nextId = 1;

    public MxHandle register(String kind, Object object) {
        long id = nextId++;
        objects.put(id, object);
        return new MxHandle(kind, id);
    }

    /**
     * 为已完成的任务分配 id；结果保存在句柄里，表中不留条目
     */
    public MxHandle completedTask(String kind, MxValue result) {
        return MxHandle.completedTask(kind, nextId++, result);
    }

    /**
     * 取出句柄指向的对象
     *
     * @throws MxRuntimeException 句柄种类不符或已失效（ArgumentMismatch）
     */
    public <T> T resolve(MxHandle handle, String kind, Class<T> type) {
        Object object = objects.get(handle.getId());
        if (!handle.getKind().equals(kind) || !type.isInstance(object)) {
            throw new MxRuntimeException(RuntimeErrorKind.ArgumentMismatch,
                    "expected a " + kind + " handle, got " + handle, null, kind);
        }
        return type.cast(object);
    }

    public int size() {
        return objects.size();
    }

    public void clear() {
        objects.clear();
    }
}
