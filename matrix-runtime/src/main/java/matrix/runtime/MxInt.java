package matrix.runtime;

/**
 * Int 值（64 位整数）
 */
public final class MxInt extends MxValue {

    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1024;
    private static final MxInt[] CACHE = new MxInt[CACHE_HIGH - CACHE_LOW + 1];
    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new MxInt(CACHE_LOW + i);
        }
    }

    /** 获取 MxInt 实例，优先从缓存取 */
    public static MxInt of(long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new MxInt(value);
    }

    private final long value;

    private MxInt(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Int";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isInt() {
        return true;
    }

    @Override
    public long asInt() {
        return value;
    }

    @Override
    public double asNumber() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MxInt && ((MxInt) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
