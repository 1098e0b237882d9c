package matrix.runtime;

/**
 * 指向外部协作者对象（物理世界、量子线路）或已完成任务的不透明句柄
 *
 * <p>解释器只保存句柄，从不读取或修改协作者的状态。任务句柄直接携带已算出的结果，不占句柄表。</p>
 */
public final class MxHandle extends MxValue {

    private final String kind;
    private final long id;
    private final MxValue result;

    public MxHandle(String kind, long id) {
        this(kind, id, null);
    }

    private MxHandle(String kind, long id, MxValue result) {
        this.kind = kind;
        this.id = id;
        this.result = result;
    }

    /** 已完成的任务 */
    public static MxHandle completedTask(String kind, long id, MxValue result) {
        return new MxHandle(kind, id, result);
    }

    /** 任务结果；协作者句柄返回 null */
    public MxValue getResult() {
        return result;
    }

    public String getKind() {
        return kind;
    }

    public long getId() {
        return id;
    }

    @Override
    public String getTypeName() {
        return kind;
    }

    @Override
    public Object toJavaValue() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MxHandle)) return false;
        MxHandle other = (MxHandle) o;
        return other.kind.equals(kind) && other.id == id;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "<" + kind + " #" + id + ">";
    }
}
