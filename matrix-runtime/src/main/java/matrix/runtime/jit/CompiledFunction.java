package matrix.runtime.jit;

import com.matrixlang.compiler.ast.SourceLocation;
import matrix.runtime.MxValue;

import java.util.List;

/**
 * 编译后的函数：参数按位置放入槽位，体为 {@link ClosureCompiler} 生成的节点树
 */
public final class CompiledFunction {

    private final String name;
    private final int arity;
    private final CallDepthGuard guard;
    private ClosureCompiler.Node body;

    CompiledFunction(String name, int arity, CallDepthGuard guard) {
        this.name = name;
        this.arity = arity;
        this.guard = guard;
    }

    void setBody(ClosureCompiler.Node body) {
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    /**
     * @throws JitBailout 参数或中间值不是可编译的数值 / 布尔形状
     */
    public MxValue invoke(List<MxValue> args, SourceLocation location) {
        MxValue[] slots = args.toArray(new MxValue[0]);
        for (MxValue v : slots) {
            ClosureCompiler.requireScalar(v);
        }
        try {
            return invokeSlots(slots, location);
        } catch (StackOverflowError e) {
            throw new JitBailout("stack exhausted in '" + name + "'");
        }
    }

    MxValue invokeSlots(MxValue[] slots, SourceLocation location) {
        guard.enter(name, location);
        try {
            return body.eval(slots);
        } finally {
            guard.exit();
        }
    }
}
