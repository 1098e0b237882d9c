package matrix.runtime;

/**
 * Unit 值（单例）
 */
public final class MxUnit extends MxValue {

    public static final MxUnit UNIT = new MxUnit();

    private MxUnit() {
    }

    @Override
    public String getTypeName() {
        return "Unit";
    }

    @Override
    public Object toJavaValue() {
        return null;
    }

    @Override
    public boolean isUnit() {
        return true;
    }

    @Override
    public String toString() {
        return "()";
    }
}
