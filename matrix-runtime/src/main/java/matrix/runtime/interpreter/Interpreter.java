package matrix.runtime.interpreter;

import com.matrixlang.compiler.analysis.TypeAnnotations;
import com.matrixlang.compiler.analysis.TypeclassInfo;
import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.Program;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.decl.*;
import com.matrixlang.compiler.ast.expr.*;
import com.matrixlang.compiler.ast.stmt.*;
import com.matrixlang.compiler.ast.type.ArrayTypeRef;
import com.matrixlang.compiler.ast.type.FunctionTypeRef;
import com.matrixlang.compiler.ast.type.SimpleType;
import com.matrixlang.compiler.ast.type.TypeRef;
import com.matrixlang.compiler.analysis.types.OpaqueType;
import matrix.runtime.*;
import matrix.runtime.collab.HandleTable;
import matrix.runtime.interpreter.builtin.BuiltinRegistry;
import matrix.runtime.jit.CallDepthGuard;
import matrix.runtime.jit.CompiledFunction;
import matrix.runtime.jit.JitBailout;
import matrix.runtime.jit.JitEngine;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 树遍历求值器
 *
 * <p>只求值通过类型检查的程序。顶层绑定按层累积：每次 {@link #evaluate} 在已提交环境的子帧中执行，
 * 成功后由 {@link #commit} 提交；失败时本次的赋值与实例登记全部撤销。</p>
 *
 * <p>parallel / spawn / wait 是顺序语义：parallel 的语句按顺序在当前帧执行，
 * spawn 立即求值并返回包装结果的句柄，wait 只是取出句柄里的结果。</p>
 */
public final class Interpreter implements AstVisitor<MxValue, Environment>, ExecutionContext, CallDepthGuard {

    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    /** 内置模块名：导入它们不做任何事 */
    private static final Set<String> BUILTIN_MODULES = Collections.unmodifiableSet(
            new HashSet<String>(Arrays.asList("std", "math", "io", "physics", "quantum")));

    /** 区间最多生成的元素数 */
    static final long MAX_RANGE_SIZE = 10_000_000L;

    // 每层语言调用约占十几个 Java 栈帧，深层嵌套的表达式更多
    static final long STACK_BYTES_PER_CALL = 16L * 1024;
    static final long MIN_EVAL_STACK_BYTES = 4L * 1024 * 1024;

    private final BuiltinRegistry registry;
    private final SessionConfig config;
    private final HandleTable handles = new HandleTable();
    private final Random random;
    private final JitEngine jit;

    private Environment globals = new Environment();
    private InstanceTable instances = new InstanceTable();
    private final AssignmentJournal journal = new AssignmentJournal();
    /** 累积的检查决定：之前提交的闭包里的矩阵字面量仍要查到 */
    private TypeAnnotations annotations = new TypeAnnotations();
    private int callDepth;

    public Interpreter(BuiltinRegistry registry, SessionConfig config) {
        this.registry = registry;
        this.config = config;
        this.random = config.getRandomSeed() != null ? new Random(config.getRandomSeed()) : new Random();
        this.jit = config.isJitEnabled() ? new JitEngine(config.getJitCacheSize(), this) : null;
    }

    // ============ 会话接口 ============

    /**
     * 一次求值的结果：程序值与尚未提交的顶层帧
     */
    public static final class Evaluation {
        private final MxValue value;
        private final Environment frame;
        private final Environment base;

        Evaluation(MxValue value, Environment frame, Environment base) {
            this.value = value;
            this.frame = frame;
            this.base = base;
        }

        public MxValue getValue() {
            return value;
        }
    }

    /**
     * 求值程序。出错时撤销本次的赋值与实例登记并重新抛出。
     *
     * @param checked 检查器对本程序作出的决定（矩阵字面量等）
     */
    public Evaluation evaluate(Program program, TypeAnnotations checked) {
        Environment base = globals;
        Environment layer = base.child();
        Map<String, Map<String, Map<String, MxValue>>> instanceSnapshot = instances.snapshot();
        if (checked != null) {
            annotations.mergeFrom(checked);
        }
        journal.clear();
        callDepth = 0;
        try {
            MxValue result = runOnEvaluationThread(program, layer);
            return new Evaluation(result, layer, base);
        } catch (RuntimeException e) {
            journal.undo();
            instances.restore(instanceSnapshot);
            throw e;
        }
    }

    /**
     * 在专用线程上执行语句；线程栈按 maxCallDepth 预留，使配置的深度在默认栈较小的线程上也能达到
     */
    private MxValue runOnEvaluationThread(final Program program, final Environment layer) {
        final MxValue[] result = new MxValue[1];
        final Throwable[] failure = new Throwable[1];
        Thread worker = new Thread(null, () -> {
            try {
                MxValue value = MxUnit.UNIT;
                for (Statement stmt : program.getStatements()) {
                    value = execute(stmt, layer);
                }
                result[0] = value;
            } catch (RuntimeException | Error e) {
                failure[0] = e;
            }
        }, "matrix-eval", stackBytes(config.getMaxCallDepth()));
        worker.start();
        joinUninterruptibly(worker);
        if (failure[0] instanceof RuntimeException) throw (RuntimeException) failure[0];
        if (failure[0] instanceof Error) throw (Error) failure[0];
        return result[0];
    }

    static long stackBytes(int maxCallDepth) {
        return Math.max(MIN_EVAL_STACK_BYTES, maxCallDepth * STACK_BYTES_PER_CALL);
    }

    private static void joinUninterruptibly(Thread worker) {
        boolean interrupted = false;
        while (true) {
            try {
                worker.join();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /** 使一次求值新增的绑定对之后的求值可见 */
    public void commit(Evaluation evaluation) {
        if (evaluation.base != globals) {
            throw new IllegalStateException("evaluation is not based on the current globals");
        }
        globals = evaluation.frame;
        journal.clear();
    }

    /** 丢弃全部顶层绑定与实例 */
    public void reset() {
        globals = new Environment();
        instances = new InstanceTable();
        annotations = new TypeAnnotations();
        journal.clear();
        handles.clear();
        if (jit != null) jit.clear();
    }

    /** 已提交的顶层环境 */
    public Environment getGlobals() {
        return globals;
    }

    public BuiltinRegistry getRegistry() {
        return registry;
    }

    /** JIT 关闭时为 null */
    public JitEngine getJitEngine() {
        return jit;
    }

    // ============ ExecutionContext ============

    @Override
    public MxValue invoke(MxValue callee, List<MxValue> args) {
        return callFunction(callee, args, null);
    }

    @Override
    public PrintStream getOut() {
        return config.getOut();
    }

    @Override
    public Random getRandom() {
        return random;
    }

    @Override
    public HandleTable getHandles() {
        return handles;
    }

    // ============ 调用深度 ============

    @Override
    public void enter(String function, SourceLocation location) {
        if (++callDepth > config.getMaxCallDepth()) {
            callDepth--;
            throw new MxRuntimeException(RuntimeErrorKind.CallDepthExceeded,
                    "maximum call depth " + config.getMaxCallDepth() + " exceeded in '"
                            + (function != null ? function : "lambda") + "'", location, function);
        }
    }

    @Override
    public void exit() {
        callDepth--;
    }

    // ============ 求值入口 ============

    MxValue evaluate(Expression expr, Environment env) {
        return expr.accept(this, env);
    }

    MxValue execute(Statement stmt, Environment env) {
        return stmt.accept(this, env);
    }

    static MxValue literalValue(Literal literal) {
        switch (literal.getKind()) {
            case INT: return MxInt.of((Long) literal.getValue());
            case FLOAT: return MxFloat.of((Double) literal.getValue());
            case BOOL: return MxBool.of((Boolean) literal.getValue());
            case STRING: return MxString.of((String) literal.getValue());
            default: return MxUnit.UNIT;
        }
    }

    // ============ 调用 ============

    /**
     * 调用函数值；内置函数里没有位置的错误补上调用点位置
     */
    MxValue callFunction(MxValue callee, List<MxValue> args, SourceLocation location) {
        if (callee instanceof MxClosure) {
            return callClosure((MxClosure) callee, args, location);
        }
        if (callee instanceof MxCallable) {
            try {
                return ((MxCallable) callee).call(this, args);
            } catch (MxRuntimeException e) {
                throw e.locatedAt(location);
            }
        }
        throw MxRuntimeException.argumentMismatch(callee.toString(), "a function", callee.getTypeName(), location);
    }

    MxValue callClosure(MxClosure closure, List<MxValue> args, SourceLocation location) {
        LambdaExpr lambda = closure.getLambda();
        if (args.size() != lambda.getArity()) {
            throw MxRuntimeException.argumentMismatch(closure.toString(), lambda.getArity() + " argument(s)",
                    String.valueOf(args.size()), location);
        }
        if (jit != null && closure.getName() != null) {
            CompiledFunction compiled = jit.lookup(closure.getName(), lambda);
            if (compiled != null) {
                try {
                    return compiled.invoke(args, location);
                } catch (JitBailout e) {
                    LOG.fine("JIT bailout in '" + closure.getName() + "': " + e.getMessage()
                            + ", falling back to interpretation");
                }
            }
        }
        enter(closure.getName(), location);
        try {
            Environment frame = closure.getScope().child();
            List<Parameter> params = lambda.getParams();
            for (int i = 0; i < params.size(); i++) {
                frame.define(params.get(i).getName(), args.get(i), false);
            }
            return evaluate(lambda.getBody(), frame);
        } catch (StackOverflowError e) {
            throw new MxRuntimeException(RuntimeErrorKind.CallDepthExceeded,
                    "call stack exhausted in '" + (closure.getName() != null ? closure.getName() : "lambda") + "'",
                    location, closure.getName());
        } finally {
            exit();
        }
    }

    // ============ 语句 ============

    @Override
    public MxValue visitProgram(Program node, Environment env) {
        MxValue result = MxUnit.UNIT;
        for (Statement stmt : node.getStatements()) {
            result = execute(stmt, env);
        }
        return result;
    }

    @Override
    public MxValue visitLetStmt(LetStmt node, Environment env) {
        return bind(node.getName(), node.isMutable(), node.getValue(), env);
    }

    /**
     * 在 env 中定义绑定，返回值
     *
     * <p>不可变的 lambda 绑定分两步：先占住槽位，再求值闭包（闭包的作用域包含该槽位），最后填入闭包。
     * 这样递归函数在体内能看到自己，而闭包不直接引用自身。</p>
     */
    private MxValue bind(String name, boolean mutable, Expression value, Environment env) {
        if (value instanceof LambdaExpr && !mutable) {
            int slot = env.definePlaceholder(name);
            MxValue closure = new MxClosure(name, (LambdaExpr) value, env.child(), this);
            env.fill(slot, closure);
            return closure;
        }
        MxValue result = evaluate(value, env);
        env.define(name, result, mutable);
        return result;
    }

    @Override
    public MxValue visitAssignStmt(AssignStmt node, Environment env) {
        MxValue value = evaluate(node.getValue(), env);
        env.assign(node.getName(), value, journal, node.getLocation());
        return MxUnit.UNIT;
    }

    @Override
    public MxValue visitExpressionStmt(ExpressionStmt node, Environment env) {
        return evaluate(node.getExpression(), env);
    }

    // ============ 声明 ============

    @Override
    public MxValue visitStructDecl(StructDecl node, Environment env) {
        env.defineStruct(new StructDefinition(node, env.child()));
        return MxUnit.UNIT;
    }

    @Override
    public MxValue visitTypeclassDecl(TypeclassDecl node, Environment env) {
        for (MethodSignature method : node.getMethods()) {
            TypeRef type = method.getType();
            int arity = type instanceof FunctionTypeRef ? ((FunctionTypeRef) type).getParamTypes().size() : -1;
            int dispatch = TypeclassInfo.dispatchIndexOf(type, node.getTypeParameter());
            env.define(method.getName(),
                    new MxTypeclassMethod(node.getName(), method.getName(), arity, dispatch, instances), false);
        }
        return MxUnit.UNIT;
    }

    @Override
    public MxValue visitInstanceDecl(InstanceDecl node, Environment env) {
        String head = headNameOf(node.getInstanceType());
        for (MethodImpl impl : node.getMethods()) {
            MxValue value;
            if (impl.getValue() instanceof LambdaExpr) {
                value = new MxClosure(node.getTypeclassName() + "." + impl.getName(),
                        (LambdaExpr) impl.getValue(), env.child(), this);
            } else {
                value = evaluate(impl.getValue(), env);
            }
            instances.define(node.getTypeclassName(), head, impl.getName(), value);
        }
        return MxUnit.UNIT;
    }

    /** 实例类型的类型头名，与值的 {@link MxValue#getTypeName()} 对应 */
    static String headNameOf(TypeRef type) {
        if (type instanceof ArrayTypeRef) return "Array";
        if (type instanceof FunctionTypeRef) return "Function";
        return ((SimpleType) type).getName();
    }

    @Override
    public MxValue visitModuleDecl(ModuleDecl node, Environment env) {
        Environment body = env.child();
        for (Statement stmt : node.getBody()) {
            execute(stmt, body);
        }
        env.defineModule(new MxModule(node.getName(), body.getLocalBindings()));
        return MxUnit.UNIT;
    }

    @Override
    public MxValue visitImportDecl(ImportDecl node, Environment env) {
        MxModule module = env.lookupModule(node.getModuleName());
        if (module == null) {
            if (BUILTIN_MODULES.contains(node.getModuleName())) return MxUnit.UNIT;
            throw MxRuntimeException.undefinedVariable(node.getModuleName(), node.getLocation());
        }
        if (node.isWildcard()) {
            for (Map.Entry<String, MxValue> e : module.getMembers().entrySet()) {
                env.define(e.getKey(), e.getValue(), false);
            }
            return MxUnit.UNIT;
        }
        for (String item : node.getItems()) {
            MxValue member = module.getMember(item);
            if (member == null) {
                throw MxRuntimeException.undefinedVariable(module.getName() + "." + item, node.getLocation());
            }
            env.define(item, member, false);
        }
        return MxUnit.UNIT;
    }

    // ============ 表达式 ============

    @Override
    public MxValue visitLiteral(Literal node, Environment env) {
        return literalValue(node);
    }

    @Override
    public MxValue visitIdentifier(Identifier node, Environment env) {
        MxValue value = env.lookup(node.getName());
        if (value == null) {
            value = registry.lookupValue(node.getName());
        }
        if (value == null) {
            throw MxRuntimeException.undefinedVariable(node.getName(), node.getLocation());
        }
        if (value instanceof MxTypeclassMethod && !((MxTypeclassMethod) value).isFunction()) {
            try {
                return ((MxTypeclassMethod) value).resolveConstant();
            } catch (MxRuntimeException e) {
                throw e.locatedAt(node.getLocation());
            }
        }
        return value;
    }

    @Override
    public MxValue visitBinaryExpr(BinaryExpr node, Environment env) {
        BinaryExpr.BinaryOp op = node.getOperator();
        MxValue left = evaluate(node.getLeft(), env);
        if (op == BinaryExpr.BinaryOp.AND) {
            return left.asBool() ? MxBool.of(evaluate(node.getRight(), env).asBool()) : MxBool.FALSE;
        }
        if (op == BinaryExpr.BinaryOp.OR) {
            return left.asBool() ? MxBool.TRUE : MxBool.of(evaluate(node.getRight(), env).asBool());
        }
        MxValue right = evaluate(node.getRight(), env);
        return BinaryOps.apply(op, left, right, node.getLocation());
    }

    @Override
    public MxValue visitUnaryExpr(UnaryExpr node, Environment env) {
        MxValue operand = evaluate(node.getOperand(), env);
        if (node.getOperator() == UnaryExpr.UnaryOp.NOT) {
            return MxBool.of(!operand.asBool());
        }
        return BinaryOps.negate(operand, node.getLocation());
    }

    @Override
    public MxValue visitCallExpr(CallExpr node, Environment env) {
        MxValue callee = evaluate(node.getCallee(), env);
        List<MxValue> args = new ArrayList<MxValue>(node.getArguments().size());
        for (Expression arg : node.getArguments()) {
            args.add(evaluate(arg, env));
        }
        return callFunction(callee, args, node.getLocation());
    }

    @Override
    public MxValue visitIndexExpr(IndexExpr node, Environment env) {
        MxValue target = evaluate(node.getTarget(), env);
        long index = evaluate(node.getIndex(), env).asInt();
        if (target.isArray()) {
            MxArray array = target.asArray();
            if (index < 0 || index >= array.size()) {
                throw MxRuntimeException.indexOutOfBounds(index, array.size(), node.getIndex().getLocation());
            }
            return array.get((int) index);
        }
        if (target.isMatrix()) {
            MxMatrix matrix = target.asMatrix();
            if (index < 0 || index >= matrix.getRows()) {
                throw MxRuntimeException.indexOutOfBounds(index, matrix.getRows(), node.getIndex().getLocation());
            }
            return matrix.row((int) index);
        }
        throw MxRuntimeException.argumentMismatch("[]", "an array or matrix", target.getTypeName(),
                node.getTarget().getLocation());
    }

    @Override
    public MxValue visitFieldAccessExpr(FieldAccessExpr node, Environment env) {
        // M.member：名字未被值遮蔽时按模块成员解析
        if (node.getTarget() instanceof Identifier) {
            String name = ((Identifier) node.getTarget()).getName();
            if (env.lookup(name) == null && registry.lookupValue(name) == null) {
                MxModule module = env.lookupModule(name);
                if (module != null) {
                    MxValue member = module.getMember(node.getField());
                    if (member == null) {
                        throw MxRuntimeException.undefinedVariable(name + "." + node.getField(), node.getLocation());
                    }
                    return member;
                }
            }
        }
        MxValue target = evaluate(node.getTarget(), env);
        if (target instanceof MxStruct) {
            MxValue field = ((MxStruct) target).getField(node.getField());
            if (field != null) return field;
        }
        throw MxRuntimeException.argumentMismatch("." + node.getField(),
                "a struct with field '" + node.getField() + "'", target.getTypeName(), node.getLocation());
    }

    @Override
    public MxValue visitLambdaExpr(LambdaExpr node, Environment env) {
        return new MxClosure(null, node, env.child(), this);
    }

    @Override
    public MxValue visitLetExpr(LetExpr node, Environment env) {
        Environment scope = env.child();
        bind(node.getName(), node.isMutable(), node.getValue(), scope);
        return evaluate(node.getBody(), scope);
    }

    @Override
    public MxValue visitBlockExpr(BlockExpr node, Environment env) {
        Environment scope = env.child();
        for (Statement stmt : node.getStatements()) {
            execute(stmt, scope);
        }
        return node.getTrailing() != null ? evaluate(node.getTrailing(), scope) : MxUnit.UNIT;
    }

    @Override
    public MxValue visitIfExpr(IfExpr node, Environment env) {
        if (evaluate(node.getCondition(), env).asBool()) {
            MxValue value = evaluate(node.getThenBranch(), env);
            return node.hasElse() ? value : MxUnit.UNIT;
        }
        return node.hasElse() ? evaluate(node.getElseBranch(), env) : MxUnit.UNIT;
    }

    @Override
    public MxValue visitMatchExpr(MatchExpr node, Environment env) {
        MxValue scrutinee = evaluate(node.getScrutinee(), env);
        for (MatchArm arm : node.getArms()) {
            Environment scope = env.child();
            if (!PatternMatcher.matches(arm.getPattern(), scrutinee, scope)) continue;
            if (arm.getGuard() != null && !evaluate(arm.getGuard(), scope).asBool()) continue;
            return evaluate(arm.getBody(), scope);
        }
        throw new MxRuntimeException(RuntimeErrorKind.MatchFailure,
                "no match arm matched value " + scrutinee.toDisplayString(), node.getLocation(),
                scrutinee.toDisplayString());
    }

    @Override
    public MxValue visitStructLiteral(StructLiteral node, Environment env) {
        StructDefinition struct = env.lookupStruct(node.getStructName());
        if (struct == null) {
            throw MxRuntimeException.undefinedVariable(node.getStructName(), node.getLocation());
        }
        Map<String, MxValue> given = new HashMap<String, MxValue>();
        for (FieldInit init : node.getFields()) {
            given.put(init.getName(), evaluate(init.getValue(), env));
        }
        Map<String, MxValue> fields = new LinkedHashMap<String, MxValue>();
        for (StructField field : struct.getDecl().getFields()) {
            MxValue value = given.get(field.getName());
            if (value == null) {
                if (field.getDefaultValue() == null) {
                    throw MxRuntimeException.argumentMismatch(node.getStructName(),
                            "a value for field '" + field.getName() + "'", "none", node.getLocation());
                }
                value = evaluate(field.getDefaultValue(), struct.getScope());
            }
            fields.put(field.getName(), value);
        }
        return new MxStruct(node.getStructName(), fields);
    }

    @Override
    public MxValue visitArrayLiteral(ArrayLiteral node, Environment env) {
        List<MxValue> elements = new ArrayList<MxValue>(node.getElements().size());
        for (Expression e : node.getElements()) {
            elements.add(evaluate(e, env));
        }
        return new MxArray(elements);
    }

    /**
     * 按检查器的决定构造 Matrix 或嵌套数组；未经检查时按元素是否全为同一数值类型决定
     */
    @Override
    public MxValue visitMatrixLiteral(MatrixLiteral node, Environment env) {
        List<List<MxValue>> rows = new ArrayList<List<MxValue>>();
        for (List<Expression> row : node.getRows()) {
            List<MxValue> values = new ArrayList<MxValue>(row.size());
            for (Expression cell : row) {
                values.add(evaluate(cell, env));
            }
            rows.add(values);
        }
        Boolean decision = annotations.isMatrix(node);
        boolean matrix = decision != null ? decision : allSameNumeric(rows);
        if (matrix) {
            return MxMatrix.fromRows(rows);
        }
        List<MxValue> outer = new ArrayList<MxValue>(rows.size());
        for (List<MxValue> row : rows) {
            outer.add(new MxArray(row));
        }
        return new MxArray(outer);
    }

    private static boolean allSameNumeric(List<List<MxValue>> rows) {
        String type = rows.get(0).get(0).getTypeName();
        for (List<MxValue> row : rows) {
            for (MxValue v : row) {
                if (!v.isNumber() || !v.getTypeName().equals(type)) return false;
            }
        }
        return true;
    }

    @Override
    public MxValue visitRangeExpr(RangeExpr node, Environment env) {
        long start = evaluate(node.getStart(), env).asInt();
        long end = evaluate(node.getEnd(), env).asInt();
        long last = node.isInclusive() ? end : end - 1;
        if (last < start) return MxArray.EMPTY;
        if (last - start + 1 > MAX_RANGE_SIZE || last - start + 1 <= 0) {
            throw MxRuntimeException.argumentMismatch("..", "at most " + MAX_RANGE_SIZE + " elements",
                    start + ".." + end, node.getLocation());
        }
        List<MxValue> elements = new ArrayList<MxValue>((int) (last - start + 1));
        for (long i = start; i <= last; i++) {
            elements.add(MxInt.of(i));
        }
        return new MxArray(elements);
    }

    @Override
    public MxValue visitComprehensionExpr(ComprehensionExpr node, Environment env) {
        List<MxValue> result = new ArrayList<MxValue>();
        comprehend(node, 0, env, result);
        return new MxArray(result);
    }

    private void comprehend(ComprehensionExpr node, int clauseIndex, Environment env, List<MxValue> out) {
        if (clauseIndex == node.getClauses().size()) {
            out.add(evaluate(node.getElement(), env));
            return;
        }
        ComprehensionClause clause = node.getClauses().get(clauseIndex);
        MxValue value = evaluate(clause.getExpression(), env);
        if (!clause.isGenerator()) {
            if (value.asBool()) comprehend(node, clauseIndex + 1, env, out);
            return;
        }
        for (MxValue element : value.asArray().getElements()) {
            Environment scope = env.child();
            scope.define(clause.getVariable(), element, false);
            comprehend(node, clauseIndex + 1, scope, out);
        }
    }

    @Override
    public MxValue visitParallelExpr(ParallelExpr node, Environment env) {
        MxValue result = MxUnit.UNIT;
        for (Statement stmt : node.getStatements()) {
            result = execute(stmt, env);
        }
        return result;
    }

    @Override
    public MxValue visitSpawnExpr(SpawnExpr node, Environment env) {
        return handles.completedTask(OpaqueType.TASK, evaluate(node.getBody(), env));
    }

    @Override
    public MxValue visitWaitExpr(WaitExpr node, Environment env) {
        MxValue target = evaluate(node.getTarget(), env);
        try {
            if (target.isArray()) {
                List<MxValue> results = new ArrayList<MxValue>();
                for (MxValue task : target.asArray().getElements()) {
                    results.add(awaitTask(task));
                }
                return new MxArray(results);
            }
            return awaitTask(target);
        } catch (MxRuntimeException e) {
            throw e.locatedAt(node.getTarget().getLocation());
        }
    }

    private MxValue awaitTask(MxValue task) {
        if (!(task instanceof MxHandle) || ((MxHandle) task).getResult() == null) {
            throw MxRuntimeException.argumentMismatch("wait", "a task handle", task.getTypeName(), null);
        }
        return ((MxHandle) task).getResult();
    }
}
