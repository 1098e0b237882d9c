package matrix.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 数组值（不可变）
 */
public final class MxArray extends MxValue {

    public static final MxArray EMPTY = new MxArray(Collections.<MxValue>emptyList());

    private final List<MxValue> elements;

    public MxArray(List<MxValue> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<MxValue>(elements));
    }

    public static MxArray ofDoubles(double... values) {
        List<MxValue> elements = new ArrayList<MxValue>(values.length);
        for (double v : values) {
            elements.add(MxFloat.of(v));
        }
        return new MxArray(elements);
    }

    public List<MxValue> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public MxValue get(int index) {
        return elements.get(index);
    }

    /** 所有元素的数值（元素必须是 Int 或 Float） */
    public double[] toDoubles() {
        double[] result = new double[elements.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = elements.get(i).asNumber();
        }
        return result;
    }

    @Override
    public String getTypeName() {
        return "Array";
    }

    @Override
    public Object toJavaValue() {
        List<Object> result = new ArrayList<Object>(elements.size());
        for (MxValue e : elements) {
            result.add(e.toJavaValue());
        }
        return result;
    }

    @Override
    public boolean isArray() {
        return true;
    }

    @Override
    public MxArray asArray() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MxArray && ((MxArray) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i).toDisplayString());
        }
        return sb.append(']').toString();
    }
}
