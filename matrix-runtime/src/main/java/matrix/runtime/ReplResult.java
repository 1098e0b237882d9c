package matrix.runtime;

import java.util.Collections;
import java.util.Map;

/**
 * 一次 REPL 输入的结果：值、推断出的类型以及本次新增的顶层绑定类型
 */
public final class ReplResult {

    private final MxValue value;
    private final String type;
    private final Map<String, String> bindingTypes;

    public ReplResult(MxValue value, String type, Map<String, String> bindingTypes) {
        this.value = value;
        this.type = type;
        this.bindingTypes = Collections.unmodifiableMap(bindingTypes);
    }

    public MxValue getValue() {
        return value;
    }

    public String getType() {
        return type;
    }

    public Map<String, String> getBindingTypes() {
        return bindingTypes;
    }

    public boolean isUnit() {
        return value.isUnit();
    }

    /** REPL 回显格式：{@code value : Type} */
    public String toDisplayString() {
        return value.toDisplayString() + " : " + type;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
