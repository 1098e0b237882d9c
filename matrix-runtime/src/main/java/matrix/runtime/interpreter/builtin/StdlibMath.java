package matrix.runtime.interpreter.builtin;

import matrix.runtime.MxFloat;
import matrix.runtime.MxInt;
import matrix.runtime.MxValue;

import java.util.function.DoubleUnaryOperator;

/**
 * 数学函数与常量
 */
public final class StdlibMath {

    private StdlibMath() {}

    public static void register(BuiltinRegistry registry) {
        registry.registerConstant("pi", "Float", MxFloat.of(Math.PI));
        registry.registerConstant("e", "Float", MxFloat.of(Math.E));
        registry.registerConstant("tau", "Float", MxFloat.of(2 * Math.PI));

        // Num a：Int 进 Int 出
        registry.register("abs", "Num a => (a) -> a", NativeFunction.create(x ->
                x.isInt() ? MxInt.of(Math.abs(x.asInt())) : MxFloat.of(Math.abs(x.asFloat()))));
        registry.register("min", "Num a => (a, a) -> a", NativeFunction.create((a, b) ->
                compare(a, b) <= 0 ? a : b));
        registry.register("max", "Num a => (a, a) -> a", NativeFunction.create((a, b) ->
                compare(a, b) >= 0 ? a : b));
        registry.register("clamp", "Num a => (a, a, a) -> a", NativeFunction.create((x, lo, hi) -> {
            if (compare(lo, hi) > 0) {
                throw new IllegalArgumentException("lower bound " + lo + " exceeds upper bound " + hi);
            }
            if (compare(x, lo) < 0) return lo;
            if (compare(x, hi) > 0) return hi;
            return x;
        }));

        unary(registry, "sqrt", Math::sqrt);
        unary(registry, "cbrt", Math::cbrt);
        unary(registry, "exp", Math::exp);
        unary(registry, "ln", Math::log);
        unary(registry, "log10", Math::log10);
        unary(registry, "log2", x -> Math.log(x) / Math.log(2));
        unary(registry, "sin", Math::sin);
        unary(registry, "cos", Math::cos);
        unary(registry, "tan", Math::tan);
        unary(registry, "asin", Math::asin);
        unary(registry, "acos", Math::acos);
        unary(registry, "atan", Math::atan);
        unary(registry, "sinh", Math::sinh);
        unary(registry, "cosh", Math::cosh);
        unary(registry, "tanh", Math::tanh);
        unary(registry, "floor", Math::floor);
        unary(registry, "ceil", Math::ceil);
        unary(registry, "round", x -> (double) Math.round(x));

        registry.register("atan2", "(Float, Float) -> Float", NativeFunction.create((y, x) ->
                MxFloat.of(Math.atan2(y.asFloat(), x.asFloat()))));
        registry.register("pow", "(Float, Float) -> Float", NativeFunction.create((base, exp) ->
                MxFloat.of(Math.pow(base.asFloat(), exp.asFloat()))));
        registry.register("lerp", "(Float, Float, Float) -> Float", NativeFunction.create((a, b, t) ->
                MxFloat.of(a.asFloat() + (b.asFloat() - a.asFloat()) * t.asFloat())));

        registry.register("to_float", "(Int) -> Float", NativeFunction.create(x -> MxFloat.of(x.asInt())));
        // 向零截断
        registry.register("to_int", "(Float) -> Int", NativeFunction.create(x -> MxInt.of((long) x.asFloat())));

        registry.register("random", "() -> Float", NativeFunction.withContext(0, (ctx, args) ->
                MxFloat.of(ctx.getRandom().nextDouble())));
        registry.register("random_range", "(Float, Float) -> Float", NativeFunction.withContext(2, (ctx, args) -> {
            double lo = args.get(0).asFloat();
            double hi = args.get(1).asFloat();
            if (lo > hi) {
                throw new IllegalArgumentException("empty range [" + lo + ", " + hi + ")");
            }
            return MxFloat.of(lo + (hi - lo) * ctx.getRandom().nextDouble());
        }));
        registry.register("time", "() -> Float", NativeFunction.create(() ->
                MxFloat.of(System.currentTimeMillis() / 1000.0)));
    }

    private static void unary(BuiltinRegistry registry, String name, DoubleUnaryOperator op) {
        registry.register(name, "(Float) -> Float", NativeFunction.create(x ->
                MxFloat.of(op.applyAsDouble(x.asFloat()))));
    }

    static int compare(MxValue a, MxValue b) {
        if (a.isInt() && b.isInt()) return Long.compare(a.asInt(), b.asInt());
        return Double.compare(a.asNumber(), b.asNumber());
    }
}
