package matrix.runtime.interpreter.builtin;

import matrix.runtime.MxArray;
import matrix.runtime.MxFloat;
import matrix.runtime.MxValue;

/**
 * 向量运算（向量即 [Float]）
 */
public final class StdlibVector {

    private StdlibVector() {}

    public static void register(BuiltinRegistry registry) {
        registry.register("vec3", "(Float, Float, Float) -> [Float]", NativeFunction.create((x, y, z) ->
                MxArray.ofDoubles(x.asFloat(), y.asFloat(), z.asFloat())));

        registry.register("dot", "([Float], [Float]) -> Float", NativeFunction.create((a, b) ->
                MxFloat.of(dot(sameLength(a, b), b.asArray().toDoubles()))));

        registry.register("cross", "([Float], [Float]) -> [Float]", NativeFunction.create((a, b) -> {
            double[] u = vec3(a);
            double[] v = vec3(b);
            return MxArray.ofDoubles(
                    u[1] * v[2] - u[2] * v[1],
                    u[2] * v[0] - u[0] * v[2],
                    u[0] * v[1] - u[1] * v[0]);
        }));

        registry.register("magnitude", "([Float]) -> Float", NativeFunction.create(v ->
                MxFloat.of(magnitude(v.asArray().toDoubles()))));

        // 零向量原样返回
        registry.register("normalize", "([Float]) -> [Float]", NativeFunction.create(v -> {
            double[] d = v.asArray().toDoubles();
            double m = magnitude(d);
            if (m <= MxFloat.EPSILON) return v;
            for (int i = 0; i < d.length; i++) d[i] /= m;
            return MxArray.ofDoubles(d);
        }));

        registry.register("distance", "([Float], [Float]) -> Float", NativeFunction.create((a, b) -> {
            double[] u = sameLength(a, b);
            double[] v = b.asArray().toDoubles();
            for (int i = 0; i < u.length; i++) u[i] -= v[i];
            return MxFloat.of(magnitude(u));
        }));

        // r = i - 2 (i·n) n
        registry.register("reflect", "([Float], [Float]) -> [Float]", NativeFunction.create((incident, normal) -> {
            double[] i = sameLength(incident, normal);
            double[] n = normal.asArray().toDoubles();
            double k = 2 * dot(i, n);
            for (int j = 0; j < i.length; j++) i[j] -= k * n[j];
            return MxArray.ofDoubles(i);
        }));
    }

    static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) sum += a[i] * b[i];
        return sum;
    }

    static double magnitude(double[] v) {
        return Math.sqrt(dot(v, v));
    }

    /** 三维向量的分量 */
    static double[] vec3(MxValue value) {
        double[] d = value.asArray().toDoubles();
        if (d.length != 3) {
            throw new IllegalArgumentException("expected a 3-component vector, got " + d.length + " component(s)");
        }
        return d;
    }

    private static double[] sameLength(MxValue a, MxValue b) {
        double[] u = a.asArray().toDoubles();
        if (u.length != b.asArray().size()) {
            throw new IllegalArgumentException("vector lengths differ: " + u.length + " and " + b.asArray().size());
        }
        return u;
    }
}
