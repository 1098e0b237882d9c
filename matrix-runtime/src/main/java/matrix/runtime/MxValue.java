package matrix.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * matrix-lang 运行时值的基类
 *
 * <p>值不可变（数组、矩阵、结构体的"修改"都产生新值）。类型名与类型检查器的类型头名一致，
 * 类型类按它分派。</p>
 */
public abstract class MxValue {

    /**
     * 将 Java 值转换为 MxValue
     */
    public static MxValue fromJava(Object javaValue) {
        if (javaValue == null) {
            return MxUnit.UNIT;
        }
        if (javaValue instanceof MxValue) {
            return (MxValue) javaValue;
        }
        if (javaValue instanceof Integer || javaValue instanceof Long) {
            return MxInt.of(((Number) javaValue).longValue());
        }
        if (javaValue instanceof Double || javaValue instanceof Float) {
            return MxFloat.of(((Number) javaValue).doubleValue());
        }
        if (javaValue instanceof Boolean) {
            return MxBool.of((Boolean) javaValue);
        }
        if (javaValue instanceof String) {
            return MxString.of((String) javaValue);
        }
        if (javaValue instanceof double[]) {
            return MxArray.ofDoubles((double[]) javaValue);
        }
        if (javaValue instanceof List) {
            List<MxValue> elements = new ArrayList<MxValue>();
            for (Object item : (List<?>) javaValue) {
                elements.add(fromJava(item));
            }
            return new MxArray(elements);
        }
        throw new IllegalArgumentException("Cannot convert Java object to MxValue: "
                + javaValue.getClass().getName());
    }

    /**
     * 值的类型名（Int、Float、Array、Matrix、结构体名、Function、句柄种类…）
     */
    public abstract String getTypeName();

    /**
     * 获取底层 Java 值
     */
    public abstract Object toJavaValue();

    /**
     * 作为集合元素显示时的形式；字符串在这里带引号
     */
    public String toDisplayString() {
        return toString();
    }

    // ============ 类型判断与转换 ============

    public boolean isInt() {
        return false;
    }

    public boolean isFloat() {
        return false;
    }

    public boolean isNumber() {
        return isInt() || isFloat();
    }

    public boolean isBool() {
        return false;
    }

    public boolean isString() {
        return false;
    }

    public boolean isUnit() {
        return false;
    }

    public boolean isArray() {
        return false;
    }

    public boolean isMatrix() {
        return false;
    }

    public boolean isCallable() {
        return this instanceof MxCallable;
    }

    public long asInt() {
        throw mismatch("Int");
    }

    public double asFloat() {
        throw mismatch("Float");
    }

    /** Int 或 Float 的数值 */
    public double asNumber() {
        throw mismatch("a number");
    }

    public boolean asBool() {
        throw mismatch("Bool");
    }

    public String asString() {
        throw mismatch("String");
    }

    public MxArray asArray() {
        throw mismatch("an array");
    }

    public MxMatrix asMatrix() {
        throw mismatch("a matrix");
    }

    public MxCallable asCallable() {
        if (this instanceof MxCallable) return (MxCallable) this;
        throw mismatch("a function");
    }

    protected MxRuntimeException mismatch(String expected) {
        return new MxRuntimeException(RuntimeErrorKind.ArgumentMismatch,
                "expected " + expected + ", got " + getTypeName(), null, getTypeName());
    }
}
