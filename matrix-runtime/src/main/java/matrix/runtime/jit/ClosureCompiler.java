package matrix.runtime.jit;

import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.decl.Parameter;
import com.matrixlang.compiler.ast.expr.*;
import matrix.runtime.MxBool;
import matrix.runtime.MxFloat;
import matrix.runtime.MxInt;
import matrix.runtime.MxValue;
import matrix.runtime.interpreter.BinaryOps;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把可编译的 lambda 转成 Java 函数对象树
 *
 * <p>参数解析为槽位下标，运算委托给 {@link BinaryOps}，因此结果与解释执行一致。
 * 运行时遇到非数值 / 布尔的值时抛出 {@link JitBailout}。</p>
 */
public final class ClosureCompiler {

    /** 编译后的表达式节点 */
    interface Node {
        MxValue eval(MxValue[] slots);
    }

    private ClosureCompiler() {}

    /**
     * @throws IllegalArgumentException lambda 含有不可编译的构造
     */
    public static CompiledFunction compile(String name, LambdaExpr lambda, CallDepthGuard guard) {
        JitDecision decision = JitEligibilityAnalyzer.analyze(name, lambda);
        if (!decision.isEligible()) {
            throw new IllegalArgumentException("'" + name + "' is not compilable: " + decision.getReason());
        }
        Map<String, Integer> slots = new HashMap<String, Integer>();
        List<Parameter> params = lambda.getParams();
        for (int i = 0; i < params.size(); i++) {
            slots.put(params.get(i).getName(), i);
        }
        CompiledFunction function = new CompiledFunction(name, lambda.getArity(), guard);
        function.setBody(compileExpr(lambda.getBody(), slots, function));
        return function;
    }

    static MxValue requireScalar(MxValue value) {
        if (!(value instanceof MxInt) && !(value instanceof MxFloat) && !(value instanceof MxBool)) {
            throw new JitBailout("unsupported value of type " + value.getTypeName());
        }
        return value;
    }

    private static boolean requireBool(MxValue value) {
        if (!(value instanceof MxBool)) {
            throw new JitBailout("expected Bool, got " + value.getTypeName());
        }
        return ((MxBool) value).getValue();
    }

    private static Node compileExpr(Expression expr, final Map<String, Integer> slots, final CompiledFunction self) {
        if (expr instanceof Literal) {
            final MxValue constant = literal((Literal) expr);
            return s -> constant;
        }
        if (expr instanceof Identifier) {
            final int slot = slots.get(((Identifier) expr).getName());
            return s -> s[slot];
        }
        if (expr instanceof BlockExpr) {
            return compileExpr(((BlockExpr) expr).getTrailing(), slots, self);
        }
        if (expr instanceof UnaryExpr) {
            final UnaryExpr unary = (UnaryExpr) expr;
            final Node operand = compileExpr(unary.getOperand(), slots, self);
            if (unary.getOperator() == UnaryExpr.UnaryOp.NOT) {
                return s -> MxBool.of(!requireBool(operand.eval(s)));
            }
            final SourceLocation loc = unary.getLocation();
            return s -> BinaryOps.negate(requireScalar(operand.eval(s)), loc);
        }
        if (expr instanceof BinaryExpr) {
            return compileBinary((BinaryExpr) expr, slots, self);
        }
        if (expr instanceof IfExpr) {
            IfExpr ifExpr = (IfExpr) expr;
            final Node cond = compileExpr(ifExpr.getCondition(), slots, self);
            final Node then = compileExpr(ifExpr.getThenBranch(), slots, self);
            final Node otherwise = compileExpr(ifExpr.getElseBranch(), slots, self);
            return s -> requireBool(cond.eval(s)) ? then.eval(s) : otherwise.eval(s);
        }
        if (expr instanceof CallExpr) {
            CallExpr call = (CallExpr) expr;
            final Node[] args = new Node[call.getArguments().size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = compileExpr(call.getArguments().get(i), slots, self);
            }
            final SourceLocation loc = call.getLocation();
            return s -> {
                MxValue[] frame = new MxValue[args.length];
                for (int i = 0; i < args.length; i++) {
                    frame[i] = args[i].eval(s);
                }
                return self.invokeSlots(frame, loc);
            };
        }
        throw new IllegalArgumentException("unsupported expression " + expr.getClass().getSimpleName());
    }

    private static Node compileBinary(BinaryExpr bin, Map<String, Integer> slots, CompiledFunction self) {
        final BinaryExpr.BinaryOp op = bin.getOperator();
        final Node left = compileExpr(bin.getLeft(), slots, self);
        final Node right = compileExpr(bin.getRight(), slots, self);
        switch (op) {
            case AND:
                return s -> requireBool(left.eval(s)) ? MxBool.of(requireBool(right.eval(s))) : MxBool.FALSE;
            case OR:
                return s -> requireBool(left.eval(s)) ? MxBool.TRUE : MxBool.of(requireBool(right.eval(s)));
            default:
                final SourceLocation loc = bin.getLocation();
                return s -> {
                    MxValue l = requireScalar(left.eval(s));
                    MxValue r = requireScalar(right.eval(s));
                    return BinaryOps.apply(op, l, r, loc);
                };
        }
    }

    private static MxValue literal(Literal literal) {
        switch (literal.getKind()) {
            case INT: return MxInt.of((Long) literal.getValue());
            case FLOAT: return MxFloat.of((Double) literal.getValue());
            case BOOL: return MxBool.of((Boolean) literal.getValue());
            default: throw new IllegalArgumentException("unsupported literal " + literal.getKind());
        }
    }
}
