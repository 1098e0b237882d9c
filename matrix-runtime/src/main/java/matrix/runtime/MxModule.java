package matrix.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模块：名字 → 成员值
 */
public final class MxModule extends MxValue {

    private final String name;
    private final Map<String, MxValue> members;

    public MxModule(String name, Map<String, MxValue> members) {
        this.name = name;
        this.members = Collections.unmodifiableMap(new LinkedHashMap<String, MxValue>(members));
    }

    public String getName() {
        return name;
    }

    public Map<String, MxValue> getMembers() {
        return members;
    }

    public MxValue getMember(String member) {
        return members.get(member);
    }

    @Override
    public String getTypeName() {
        return "Module";
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public String toString() {
        return "<module " + name + ">";
    }
}
