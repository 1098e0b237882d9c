package matrix.runtime;

/**
 * Bool 值
 */
public final class MxBool extends MxValue {

    public static final MxBool TRUE = new MxBool(true);
    public static final MxBool FALSE = new MxBool(false);

    public static MxBool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    private final boolean value;

    private MxBool(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Bool";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isBool() {
        return true;
    }

    @Override
    public boolean asBool() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
