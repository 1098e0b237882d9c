package matrix.runtime.interpreter.builtin;

import matrix.runtime.MxArray;
import matrix.runtime.MxFloat;
import matrix.runtime.MxInt;
import matrix.runtime.MxRuntimeException;
import matrix.runtime.MxValue;
import matrix.runtime.RuntimeErrorKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 数组函数。数组不可变，"修改"类函数返回新数组。
 */
public final class StdlibArray {

    private StdlibArray() {}

    public static void register(BuiltinRegistry registry) {
        NativeFunction length = NativeFunction.create(a -> MxInt.of(a.asArray().size()));
        registry.register("array_length", "([a]) -> Int", length);
        registry.register("len", "([a]) -> Int", length);

        registry.register("array_push", "([a], a) -> [a]", NativeFunction.create((a, item) -> {
            List<MxValue> elements = new ArrayList<MxValue>(a.asArray().getElements());
            elements.add(item);
            return new MxArray(elements);
        }));

        // 去掉最后一个元素
        registry.register("array_pop", "([a]) -> [a]", NativeFunction.create(a -> {
            List<MxValue> elements = a.asArray().getElements();
            if (elements.isEmpty()) {
                throw new MxRuntimeException(RuntimeErrorKind.IndexOutOfBounds,
                        "cannot pop from an empty array", null, "array_pop");
            }
            return new MxArray(elements.subList(0, elements.size() - 1));
        }));

        registry.register("array_reverse", "([a]) -> [a]", NativeFunction.create(a -> {
            List<MxValue> elements = new ArrayList<MxValue>(a.asArray().getElements());
            Collections.reverse(elements);
            return new MxArray(elements);
        }));

        registry.register("array_sort", "Ord a => ([a]) -> [a]", NativeFunction.create(a -> {
            List<MxValue> elements = new ArrayList<MxValue>(a.asArray().getElements());
            elements.sort((x, y) -> x.isString()
                    ? x.asString().compareTo(y.asString())
                    : StdlibMath.compare(x, y));
            return new MxArray(elements);
        }));

        // 空数组之和为 Int 0
        registry.register("array_sum", "Num a => ([a]) -> a", NativeFunction.create(a -> {
            List<MxValue> elements = a.asArray().getElements();
            if (elements.isEmpty() || elements.get(0).isInt()) {
                long sum = 0;
                for (MxValue e : elements) sum += e.asInt();
                return MxInt.of(sum);
            }
            double sum = 0;
            for (MxValue e : elements) sum += e.asNumber();
            return MxFloat.of(sum);
        }));

        registry.register("array_avg", "Num a => ([a]) -> Float", NativeFunction.create(a -> {
            MxArray array = a.asArray();
            if (array.size() == 0) {
                throw MxRuntimeException.divisionByZero("array_avg", null);
            }
            double sum = 0;
            for (double d : array.toDoubles()) sum += d;
            return MxFloat.of(sum / array.size());
        }));

        registry.register("map", "([a], (a) -> b) -> [b]", NativeFunction.withContext(2, (ctx, args) -> {
            List<MxValue> result = new ArrayList<MxValue>();
            for (MxValue e : args.get(0).asArray().getElements()) {
                result.add(ctx.invoke(args.get(1), Collections.singletonList(e)));
            }
            return new MxArray(result);
        }));

        registry.register("filter", "([a], (a) -> Bool) -> [a]", NativeFunction.withContext(2, (ctx, args) -> {
            List<MxValue> result = new ArrayList<MxValue>();
            for (MxValue e : args.get(0).asArray().getElements()) {
                if (ctx.invoke(args.get(1), Collections.singletonList(e)).asBool()) {
                    result.add(e);
                }
            }
            return new MxArray(result);
        }));

        registry.register("fold", "([a], b, (b, a) -> b) -> b", NativeFunction.withContext(3, (ctx, args) -> {
            MxValue acc = args.get(1);
            for (MxValue e : args.get(0).asArray().getElements()) {
                acc = ctx.invoke(args.get(2), Arrays.asList(acc, e));
            }
            return acc;
        }));
    }
}
