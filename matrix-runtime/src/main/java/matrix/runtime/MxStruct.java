package matrix.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 结构体实例（不可变，字段按声明顺序）
 */
public final class MxStruct extends MxValue {

    private final String name;
    private final Map<String, MxValue> fields;

    public MxStruct(String name, Map<String, MxValue> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<String, MxValue>(fields));
    }

    public String getName() {
        return name;
    }

    public Map<String, MxValue> getFields() {
        return fields;
    }

    public MxValue getField(String field) {
        return fields.get(field);
    }

    @Override
    public String getTypeName() {
        return name;
    }

    @Override
    public Object toJavaValue() {
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        for (Map.Entry<String, MxValue> e : fields.entrySet()) {
            result.put(e.getKey(), e.getValue().toJavaValue());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MxStruct)) return false;
        MxStruct other = (MxStruct) o;
        return other.name.equals(name) && other.fields.equals(fields);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + fields.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(" { ");
        boolean first = true;
        for (Map.Entry<String, MxValue> e : fields.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey()).append(": ").append(e.getValue().toDisplayString());
            first = false;
        }
        return sb.append(fields.isEmpty() ? "}" : " }").toString();
    }
}
