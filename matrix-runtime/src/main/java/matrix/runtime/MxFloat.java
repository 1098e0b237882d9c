package matrix.runtime;

/**
 * Float 值（双精度）
 */
public final class MxFloat extends MxValue {

    /** 浮点相等的容差 */
    public static final double EPSILON = Math.ulp(1.0);

    public static MxFloat of(double value) {
        return new MxFloat(value);
    }

    private final double value;

    private MxFloat(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Float";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isFloat() {
        return true;
    }

    @Override
    public double asFloat() {
        return value;
    }

    @Override
    public double asNumber() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MxFloat && Math.abs(((MxFloat) o).value - value) < EPSILON;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
