package matrix.runtime.interpreter.builtin;

import com.matrixlang.compiler.analysis.types.TypeScheme;
import matrix.runtime.ExecutionContext;
import matrix.runtime.MxCallable;
import matrix.runtime.MxRuntimeException;
import matrix.runtime.MxValue;
import matrix.runtime.RuntimeErrorKind;

import java.util.List;

/**
 * 已注册的内置函数值：名字、方案与实现
 */
public final class BuiltinFunction extends MxValue implements MxCallable {

    private final String name;
    private final TypeScheme scheme;
    private final NativeFunction function;

    BuiltinFunction(String name, TypeScheme scheme, NativeFunction function) {
        this.name = name;
        this.scheme = scheme;
        this.function = function;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return function.getArity();
    }

    public TypeScheme getScheme() {
        return scheme;
    }

    /**
     * 先核对实参，再调用实现。协作者抛出的 Java 异常转换为运行时错误。
     */
    @Override
    public MxValue call(ExecutionContext ctx, List<MxValue> args) {
        ArgumentGuard.check(name, scheme, args);
        try {
            return function.apply(ctx, args);
        } catch (MxRuntimeException e) {
            // 值转换失败没有位置，归到本函数名下；回调里带位置的错误原样传出
            if (e.getKind() == RuntimeErrorKind.ArgumentMismatch && e.getLine() <= 0
                    && !name.equals(e.getSubject())) {
                throw new MxRuntimeException(RuntimeErrorKind.ArgumentMismatch,
                        "'" + name + "' " + e.getRawMessage(), e.getLocation(), name);
            }
            throw e;
        } catch (IndexOutOfBoundsException e) {
            throw new MxRuntimeException(RuntimeErrorKind.IndexOutOfBounds,
                    "'" + name + "': " + e.getMessage(), null, name);
        } catch (IllegalArgumentException e) {
            throw new MxRuntimeException(RuntimeErrorKind.ArgumentMismatch,
                    "'" + name + "': " + e.getMessage(), null, name);
        }
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
        return "<builtin " + name + ">";
    }
}
