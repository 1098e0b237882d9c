package matrix.runtime.interpreter.builtin;

import matrix.runtime.MxString;
import matrix.runtime.MxUnit;

/**
 * 输出与字符串转换
 */
public final class StdlibIO {

    private StdlibIO() {}

    public static void register(BuiltinRegistry registry) {
        registry.register("print", "(a) -> Unit", NativeFunction.withContext(1, (ctx, args) -> {
            ctx.getOut().print(args.get(0));
            ctx.getOut().flush();
            return MxUnit.UNIT;
        }));

        registry.register("println", "(a) -> Unit", NativeFunction.withContext(1, (ctx, args) -> {
            ctx.getOut().println(args.get(0));
            return MxUnit.UNIT;
        }));

        registry.register("to_string", "(a) -> String",
                NativeFunction.create(value -> MxString.of(value.toString())));

        registry.register("type_of", "(a) -> String",
                NativeFunction.create(value -> MxString.of(value.getTypeName())));
    }
}
