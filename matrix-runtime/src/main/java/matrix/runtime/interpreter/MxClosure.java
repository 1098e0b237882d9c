package matrix.runtime.interpreter;

import com.matrixlang.compiler.ast.expr.LambdaExpr;
import matrix.runtime.ExecutionContext;
import matrix.runtime.MxCallable;
import matrix.runtime.MxValue;

import java.util.List;

/**
 * 闭包：lambda + 定义点的作用域
 */
public final class MxClosure extends MxValue implements MxCallable {

    private final String name;
    private final LambdaExpr lambda;
    private final Environment scope;
    private final Interpreter interpreter;

    MxClosure(String name, LambdaExpr lambda, Environment scope, Interpreter interpreter) {
        this.name = name;
        this.lambda = lambda;
        this.scope = scope;
        this.interpreter = interpreter;
    }

    /** let 绑定的名字；匿名 lambda 为 null */
    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return lambda.getArity();
    }

    public LambdaExpr getLambda() {
        return lambda;
    }

    Environment getScope() {
        return scope;
    }

    @Override
    public MxValue call(ExecutionContext ctx, List<MxValue> args) {
        return interpreter.callClosure(this, args, lambda.getLocation());
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
        return "<fn " + (name != null ? name : "lambda") + "/" + getArity() + ">";
    }
}
