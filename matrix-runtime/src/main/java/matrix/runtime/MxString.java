package matrix.runtime;

/**
 * String 值
 */
public final class MxString extends MxValue {

    private static final MxString EMPTY = new MxString("");

    public static MxString of(String value) {
        return value.isEmpty() ? EMPTY : new MxString(value);
    }

    private final String value;

    private MxString(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "String";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isString() {
        return true;
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MxString && ((MxString) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
