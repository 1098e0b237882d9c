package matrix.runtime.interpreter;

import matrix.runtime.ExecutionContext;
import matrix.runtime.MxCallable;
import matrix.runtime.MxRuntimeException;
import matrix.runtime.MxValue;
import matrix.runtime.RuntimeErrorKind;

import java.util.List;

/**
 * 类型类方法：按分派参数值的类型名选择实例实现
 *
 * <p>分派参数是第一个类型恰为类参数的形参。没有这样的形参时，只有唯一实例才能调用。</p>
 */
public final class MxTypeclassMethod extends MxValue implements MxCallable {

    private final String typeclass;
    private final String method;
    private final int arity;
    private final int dispatchIndex;
    private final InstanceTable instances;

    MxTypeclassMethod(String typeclass, String method, int arity, int dispatchIndex, InstanceTable instances) {
        this.typeclass = typeclass;
        this.method = method;
        this.arity = arity;
        this.dispatchIndex = dispatchIndex;
        this.instances = instances;
    }

    @Override
    public String getName() {
        return method;
    }

    @Override
    public int getArity() {
        return arity;
    }

    public String getTypeclass() {
        return typeclass;
    }

    @Override
    public MxValue call(ExecutionContext ctx, List<MxValue> args) {
        String head = dispatchIndex >= 0 && dispatchIndex < args.size()
                ? args.get(dispatchIndex).getTypeName()
                : soleInstance();
        MxValue implementation = instances.lookup(typeclass, head, method);
        if (implementation == null) {
            throw MxRuntimeException.argumentMismatch(method, "an instance of " + typeclass, head, null);
        }
        return ctx.invoke(implementation, args);
    }

    /**
     * 非函数成员（如 {@code zero: a}）在取值时解析
     */
    MxValue resolveConstant() {
        MxValue value = instances.lookup(typeclass, soleInstance(), method);
        if (value == null) {
            throw MxRuntimeException.argumentMismatch(method, "an instance of " + typeclass, "none", null);
        }
        return value;
    }

    private String soleInstance() {
        if (instances.instanceCount(typeclass) != 1) {
            throw new MxRuntimeException(RuntimeErrorKind.ArgumentMismatch,
                    "cannot choose an instance of " + typeclass + " for '" + method
                            + "': no argument has the class type and " + instances.instanceCount(typeclass)
                            + " instances exist", null, method);
        }
        return instances.heads(typeclass).iterator().next();
    }

    boolean isFunction() {
        return arity >= 0;
    }

    @Override
    public String getTypeName() {
        return "Function";
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public String toString() {
        return "<method " + typeclass + "." + method + ">";
    }
}
