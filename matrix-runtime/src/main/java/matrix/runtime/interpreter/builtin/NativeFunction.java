package matrix.runtime.interpreter.builtin;

import matrix.runtime.ExecutionContext;
import matrix.runtime.MxValue;

import java.util.List;

/**
 * 内置函数的 Java 实现：参数个数 + 函数体
 */
public final class NativeFunction {

    /**
     * 完整形式：可以访问执行上下文
     */
    @FunctionalInterface
    public interface Body {
        MxValue apply(ExecutionContext ctx, List<MxValue> args);
    }

    @FunctionalInterface
    public interface Func0 {
        MxValue apply();
    }

    @FunctionalInterface
    public interface Func1 {
        MxValue apply(MxValue a);
    }

    @FunctionalInterface
    public interface Func2 {
        MxValue apply(MxValue a, MxValue b);
    }

    @FunctionalInterface
    public interface Func3 {
        MxValue apply(MxValue a, MxValue b, MxValue c);
    }

    private final int arity;
    private final Body body;

    public NativeFunction(int arity, Body body) {
        if (arity < 0) {
            throw new IllegalArgumentException("arity must be non-negative");
        }
        this.arity = arity;
        this.body = body;
    }

    public int getArity() {
        return arity;
    }

    public MxValue apply(ExecutionContext ctx, List<MxValue> args) {
        return body.apply(ctx, args);
    }

    // ============ 便捷工厂方法 ============

    public static NativeFunction create(Func0 func) {
        return new NativeFunction(0, (ctx, args) -> func.apply());
    }

    public static NativeFunction create(Func1 func) {
        return new NativeFunction(1, (ctx, args) -> func.apply(args.get(0)));
    }

    public static NativeFunction create(Func2 func) {
        return new NativeFunction(2, (ctx, args) -> func.apply(args.get(0), args.get(1)));
    }

    public static NativeFunction create(Func3 func) {
        return new NativeFunction(3, (ctx, args) -> func.apply(args.get(0), args.get(1), args.get(2)));
    }

    public static NativeFunction withContext(int arity, Body body) {
        return new NativeFunction(arity, body);
    }
}
