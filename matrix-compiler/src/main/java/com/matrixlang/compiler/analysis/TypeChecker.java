package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.*;
import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.Program;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.decl.*;
import com.matrixlang.compiler.ast.expr.*;
import com.matrixlang.compiler.ast.stmt.AssignStmt;
import com.matrixlang.compiler.ast.stmt.ExpressionStmt;
import com.matrixlang.compiler.ast.stmt.LetStmt;
import com.matrixlang.compiler.ast.stmt.Statement;
import com.matrixlang.compiler.ast.type.TypeRef;
import com.matrixlang.compiler.diagnostic.MatrixLangException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Algorithm W 风格的类型检查器
 *
 * <p>每个实例是一个检查会话：持有自己的类型变量计数器、替换和已提交的顶层环境。
 * 每次 {@link #check} 在已提交环境之上建立一层新环境，成功后由调用方 {@link #commit}，
 * 失败（或调用方 {@link #rollback}）时替换恢复到检查之前。</p>
 *
 * <p>声明由 {@link DeclarationChecker} 处理，模式由 {@link PatternChecker} 处理。</p>
 */
public final class TypeChecker implements AstVisitor<MxType, TypeEnvironment> {

    private static final Logger LOG = Logger.getLogger(TypeChecker.class.getName());

    private final SignatureTable signatures;
    private TypeUnifier unifier;
    private TypeEnvironment committed;
    private TypeEnvironment currentLayer;
    private TypeAnnotations annotations = new TypeAnnotations();

    private final DeclarationChecker declarations = new DeclarationChecker(this);
    private final PatternChecker patterns = new PatternChecker(this);

    public TypeChecker(SignatureTable signatures) {
        this.signatures = signatures;
        reset();
    }

    /** 丢弃所有已提交的绑定，重新开始会话 */
    public void reset() {
        this.unifier = new TypeUnifier();
        this.committed = new TypeEnvironment(signatures);
        this.currentLayer = committed;
        unifier.setInstanceLookup(new TypeUnifier.InstanceLookup() {
            @Override
            public boolean hasInstance(String typeclassName, String headName) {
                return headName != null && currentLayer.hasInstance(typeclassName, headName);
            }
        });
    }

    // ============ 会话接口 ============

    /**
     * 检查程序。出错时自动回滚并抛出 {@link TypeCheckException}；成功时返回待提交的结果。
     */
    public CheckResult check(Program program) {
        TypeUnifier.Snapshot before = unifier.snapshot();
        TypeEnvironment layer = committed.child();
        TypeAnnotations previous = annotations;
        currentLayer = layer;
        annotations = new TypeAnnotations();
        try {
            MxType result = PrimitiveType.UNIT;
            for (Statement stmt : program.getStatements()) {
                result = checkStatement(stmt, layer);
            }
            Map<String, TypeScheme> bindings = new LinkedHashMap<String, TypeScheme>();
            for (Map.Entry<String, TypeEnvironment.Binding> e : layer.getLocalBindings().entrySet()) {
                bindings.put(e.getKey(), resolved(e.getValue().getScheme()));
            }
            CheckResult checkResult = new CheckResult(program, layer, before,
                    unifier.apply(result), bindings, annotations);
            LOG.fine("checked " + program.getStatements().size() + " statement(s), type "
                    + checkResult.getType().toDisplayString());
            return checkResult;
        } catch (MatrixLangException e) {
            unifier.restore(before);
            throw e;
        } finally {
            annotations = previous;
            currentLayer = committed;
        }
    }

    /** 使结果中的新增绑定对后续检查可见 */
    public void commit(CheckResult result) {
        if (result.getLayer().getParent() != committed) {
            throw new IllegalStateException("check result is not based on the current environment");
        }
        committed = result.getLayer();
        currentLayer = committed;
    }

    /** 放弃一个已成功检查但未提交的结果 */
    public void rollback(CheckResult result) {
        if (result.getLayer().getParent() == committed) {
            unifier.restore(result.getSnapshotBefore());
        }
    }

    /**
     * 在已提交环境中推断表达式的类型（不改变会话状态），返回泛化后的方案
     */
    public TypeScheme typeOf(Expression expression) {
        TypeUnifier.Snapshot before = unifier.snapshot();
        TypeEnvironment scope = committed.child();
        TypeAnnotations previous = annotations;
        annotations = new TypeAnnotations();
        try {
            MxType type = infer(expression, scope);
            return generalize(committed, type);
        } finally {
            annotations = previous;
            unifier.restore(before);
        }
    }

    /** 已提交的顶层环境 */
    public TypeEnvironment getEnvironment() {
        return committed;
    }

    public TypeUnifier getUnifier() {
        return unifier;
    }

    // ============ 包内辅助 ============

    TypeEnvironment getCurrentLayer() {
        return currentLayer;
    }

    MxType infer(Expression expr, TypeEnvironment env) {
        return expr.accept(this, env);
    }

    MxType checkStatement(Statement stmt, TypeEnvironment env) {
        return stmt.accept(this, env);
    }

    PatternChecker patterns() {
        return patterns;
    }

    TypeResolver resolver(TypeEnvironment env) {
        return new TypeResolver(env, unifier);
    }

    /** 每个使用点都用新变量替换方案的量化变量 */
    MxType instantiate(TypeScheme scheme) {
        if (!scheme.isPolymorphic()) return scheme.getBody();
        Map<Integer, MxType> fresh = new LinkedHashMap<Integer, MxType>();
        for (TypeVariable var : scheme.getQuantified()) {
            fresh.put(var.getId(), unifier.fresh(scheme.getConstraint(var.getId())));
        }
        return new TypeSubstitution(fresh, false).apply(scheme.getBody());
    }

    /** 以指定替换实例化（类型类实例检查时固定类参数） */
    MxType instantiate(TypeScheme scheme, Map<Integer, MxType> fixed) {
        Map<Integer, MxType> mapping = new LinkedHashMap<Integer, MxType>();
        for (TypeVariable var : scheme.getQuantified()) {
            MxType given = fixed.get(var.getId());
            mapping.put(var.getId(), given != null ? given : unifier.fresh(scheme.getConstraint(var.getId())));
        }
        return new TypeSubstitution(mapping, false).apply(scheme.getBody());
    }

    /** 量化 type 中不在 env 里自由出现的变量 */
    TypeScheme generalize(TypeEnvironment env, MxType type) {
        MxType applied = unifier.apply(type);
        Set<Integer> envFree = env.freeTypeVariables(unifier);
        List<TypeVariable> quantified = new ArrayList<TypeVariable>();
        Map<Integer, TypeConstraint> constraints = new LinkedHashMap<Integer, TypeConstraint>();
        for (Integer id : unifier.freeVariables(applied)) {
            if (envFree.contains(id)) continue;
            TypeVariable var = new TypeVariable(id);
            quantified.add(var);
            TypeConstraint c = unifier.constraintOf(var);
            if (!c.isNone()) constraints.put(id, c);
        }
        return new TypeScheme(quantified, constraints, applied);
    }

    private TypeScheme resolved(TypeScheme scheme) {
        if (scheme.isPolymorphic()) return scheme;
        return TypeScheme.mono(unifier.apply(scheme.getBody()));
    }

    void unify(MxType expected, MxType found, SourceLocation location) {
        unifier.unify(expected, found, location);
    }

    void constrain(MxType type, TypeConstraint constraint, SourceLocation location) {
        unifier.constrain(type, constraint, location);
    }

    TypeVariable fresh() {
        return unifier.fresh();
    }

    MxType apply(MxType type) {
        return unifier.apply(type);
    }

    MxType prune(MxType type) {
        return unifier.prune(type);
    }

    // ============ 语句 ============

    @Override
    public MxType visitProgram(Program node, TypeEnvironment env) {
        MxType result = PrimitiveType.UNIT;
        for (Statement stmt : node.getStatements()) {
            result = checkStatement(stmt, env);
        }
        return result;
    }

    @Override
    public MxType visitLetStmt(LetStmt node, TypeEnvironment env) {
        return bindLet(node.getName(), node.isMutable(), node.getTypeAnnotation(), node.getValue(),
                env, env, node.getLocation());
    }

    /**
     * 推断 let 绑定的值并在 target 中定义名字；返回值的类型
     *
     * <p>lambda 值先以单态占位变量在内层环境中可见，支持自递归。不可变绑定被泛化。</p>
     */
    private MxType bindLet(String name, boolean mutable, TypeRef annotation, Expression value,
                           TypeEnvironment env, TypeEnvironment target, SourceLocation location) {
        MxType valueType;
        if (value instanceof LambdaExpr && !mutable) {
            TypeVariable self = fresh();
            TypeEnvironment inner = env.child();
            inner.define(name, TypeScheme.mono(self), false);
            valueType = infer(value, inner);
            unify(self, valueType, value.getLocation());
        } else {
            valueType = infer(value, env);
        }
        if (annotation != null) {
            unify(resolver(env).resolve(annotation), valueType, location);
        }
        TypeScheme scheme = mutable ? TypeScheme.mono(valueType) : generalize(env, valueType);
        target.define(name, scheme, mutable);
        return valueType;
    }

    @Override
    public MxType visitAssignStmt(AssignStmt node, TypeEnvironment env) {
        TypeEnvironment.Binding binding = env.lookup(node.getName());
        if (binding == null) {
            throw TypeCheckException.unknownIdentifier(node.getName(), node.getLocation());
        }
        if (!binding.isMutable()) {
            throw new TypeCheckException(TypeErrorKind.ImmutableAssignment,
                    "cannot assign to immutable binding '" + node.getName() + "'",
                    node.getLocation(), node.getName(), null);
        }
        MxType valueType = infer(node.getValue(), env);
        unify(binding.getScheme().getBody(), valueType, node.getValue().getLocation());
        return PrimitiveType.UNIT;
    }

    @Override
    public MxType visitExpressionStmt(ExpressionStmt node, TypeEnvironment env) {
        return infer(node.getExpression(), env);
    }

    @Override
    public MxType visitStructDecl(StructDecl node, TypeEnvironment env) {
        declarations.checkStruct(node, env);
        return PrimitiveType.UNIT;
    }

    @Override
    public MxType visitTypeclassDecl(TypeclassDecl node, TypeEnvironment env) {
        declarations.checkTypeclass(node, env);
        return PrimitiveType.UNIT;
    }

    @Override
    public MxType visitInstanceDecl(InstanceDecl node, TypeEnvironment env) {
        declarations.checkInstance(node, env);
        return PrimitiveType.UNIT;
    }

    @Override
    public MxType visitModuleDecl(ModuleDecl node, TypeEnvironment env) {
        declarations.checkModule(node, env);
        return PrimitiveType.UNIT;
    }

    @Override
    public MxType visitImportDecl(ImportDecl node, TypeEnvironment env) {
        declarations.checkImport(node, env);
        return PrimitiveType.UNIT;
    }

    // ============ 表达式 ============

    @Override
    public MxType visitLiteral(Literal node, TypeEnvironment env) {
        return literalType(node);
    }

    static MxType literalType(Literal literal) {
        switch (literal.getKind()) {
            case INT: return PrimitiveType.INT;
            case FLOAT: return PrimitiveType.FLOAT;
            case BOOL: return PrimitiveType.BOOL;
            case STRING: return PrimitiveType.STRING;
            default: return PrimitiveType.UNIT;
        }
    }

    @Override
    public MxType visitIdentifier(Identifier node, TypeEnvironment env) {
        TypeEnvironment.Binding binding = env.lookup(node.getName());
        if (binding == null) {
            throw TypeCheckException.unknownIdentifier(node.getName(), node.getLocation());
        }
        return instantiate(binding.getScheme());
    }

    @Override
    public MxType visitBinaryExpr(BinaryExpr node, TypeEnvironment env) {
        MxType left = infer(node.getLeft(), env);
        MxType right = infer(node.getRight(), env);
        SourceLocation loc = node.getLocation();

        switch (node.getOperator()) {
            case ADD:
                unify(left, right, node.getRight().getLocation());
                constrain(left, TypeConstraint.ADDABLE, loc);
                return left;
            case SUB:
            case MUL:
                unify(left, right, node.getRight().getLocation());
                constrain(left, TypeConstraint.ARITH, loc);
                return left;
            case DIV:
            case MOD:
            case POW:
                unify(left, right, node.getRight().getLocation());
                constrain(left, TypeConstraint.NUM, loc);
                return left;
            case LT:
            case GT:
            case LE:
            case GE:
                unify(left, right, node.getRight().getLocation());
                constrain(left, TypeConstraint.ORD, loc);
                return PrimitiveType.BOOL;
            case EQ:
            case NE:
                unify(left, right, node.getRight().getLocation());
                // 函数值没有相等性
                if (prune(left) instanceof FunctionType) {
                    throw TypeCheckException.mismatch("a comparable type", apply(left).toDisplayString(), loc);
                }
                return PrimitiveType.BOOL;
            case AND:
            case OR:
                unify(PrimitiveType.BOOL, left, node.getLeft().getLocation());
                unify(PrimitiveType.BOOL, right, node.getRight().getLocation());
                return PrimitiveType.BOOL;
            default:
                throw new IllegalStateException("unknown operator " + node.getOperator());
        }
    }

    @Override
    public MxType visitUnaryExpr(UnaryExpr node, TypeEnvironment env) {
        MxType operand = infer(node.getOperand(), env);
        if (node.getOperator() == UnaryExpr.UnaryOp.NOT) {
            unify(PrimitiveType.BOOL, operand, node.getOperand().getLocation());
            return PrimitiveType.BOOL;
        }
        constrain(operand, TypeConstraint.ARITH, node.getLocation());
        return operand;
    }

    @Override
    public MxType visitCallExpr(CallExpr node, TypeEnvironment env) {
        MxType callee = prune(infer(node.getCallee(), env));
        List<Expression> args = node.getArguments();

        if (callee instanceof FunctionType) {
            FunctionType fn = (FunctionType) callee;
            if (fn.getArity() != args.size()) {
                throw TypeCheckException.arity(describeCallee(node) + " expects " + fn.getArity()
                        + " argument(s), found " + args.size(), node.getLocation());
            }
            for (int i = 0; i < args.size(); i++) {
                MxType argType = infer(args.get(i), env);
                unify(fn.getParamTypes().get(i), argType, args.get(i).getLocation());
            }
            return fn.getReturnType();
        }

        if (callee instanceof TypeVariable) {
            List<MxType> argTypes = new ArrayList<MxType>();
            for (Expression arg : args) {
                argTypes.add(infer(arg, env));
            }
            TypeVariable result = fresh();
            unify(callee, new FunctionType(argTypes, result), node.getLocation());
            return result;
        }

        throw TypeCheckException.mismatch("a function", apply(callee).toDisplayString(),
                node.getCallee().getLocation());
    }

    private static String describeCallee(CallExpr node) {
        if (node.getCallee() instanceof Identifier) {
            return "'" + ((Identifier) node.getCallee()).getName() + "'";
        }
        return "function";
    }

    @Override
    public MxType visitIndexExpr(IndexExpr node, TypeEnvironment env) {
        MxType target = prune(infer(node.getTarget(), env));
        unify(PrimitiveType.INT, infer(node.getIndex(), env), node.getIndex().getLocation());

        if (target instanceof ArrayType) {
            return ((ArrayType) target).getElementType();
        }
        if (target instanceof MatrixType) {
            return new ArrayType(((MatrixType) target).getElementType());
        }
        if (target instanceof TypeVariable) {
            TypeVariable element = fresh();
            unify(new ArrayType(element), target, node.getTarget().getLocation());
            return element;
        }
        throw TypeCheckException.mismatch("an array or matrix", apply(target).toDisplayString(),
                node.getTarget().getLocation());
    }

    @Override
    public MxType visitFieldAccessExpr(FieldAccessExpr node, TypeEnvironment env) {
        // M.member：名字未被值遮蔽时按模块成员解析
        if (node.getTarget() instanceof Identifier) {
            String name = ((Identifier) node.getTarget()).getName();
            if (env.lookup(name) == null) {
                ModuleInfo module = env.lookupModule(name);
                if (module != null) {
                    TypeScheme member = module.getMember(node.getField());
                    if (member == null) {
                        throw TypeCheckException.unknownIdentifier(name + "." + node.getField(), node.getLocation());
                    }
                    return instantiate(member);
                }
            }
        }

        MxType target = prune(infer(node.getTarget(), env));
        String field = node.getField();
        if (target instanceof TypeVariable) {
            StructType owner = null;
            for (StructType struct : env.getVisibleStructs().values()) {
                if (struct.getFieldType(field) == null) continue;
                if (owner != null) {
                    throw TypeCheckException.mismatch("a known struct type for field '" + field + "'",
                            "an unresolved type " + target.toDisplayString(), node.getLocation());
                }
                owner = struct;
            }
            if (owner == null) {
                throw TypeCheckException.unknownIdentifier(field, node.getLocation());
            }
            unify(owner, target, node.getTarget().getLocation());
            return owner.getFieldType(field);
        }
        if (target instanceof StructType) {
            MxType fieldType = ((StructType) target).getFieldType(field);
            if (fieldType == null) {
                throw TypeCheckException.unknownIdentifier(((StructType) target).getName() + "." + field,
                        node.getLocation());
            }
            return fieldType;
        }
        throw TypeCheckException.mismatch("a struct with field '" + field + "'",
                apply(target).toDisplayString(), node.getTarget().getLocation());
    }

    @Override
    public MxType visitLambdaExpr(LambdaExpr node, TypeEnvironment env) {
        TypeEnvironment scope = env.child();
        TypeResolver resolver = resolver(env);
        List<MxType> paramTypes = new ArrayList<MxType>();
        Set<String> seen = new HashSet<String>();
        for (Parameter param : node.getParams()) {
            if (!seen.add(param.getName())) {
                throw TypeCheckException.arity("duplicate parameter '" + param.getName() + "'",
                        param.getLocation());
            }
            MxType type = param.hasType() ? resolver.resolve(param.getType()) : fresh();
            paramTypes.add(type);
            scope.define(param.getName(), TypeScheme.mono(type), false);
        }
        MxType body = infer(node.getBody(), scope);
        if (node.getReturnType() != null) {
            unify(resolver.resolve(node.getReturnType()), body, node.getBody().getLocation());
        }
        return new FunctionType(paramTypes, body);
    }

    @Override
    public MxType visitLetExpr(LetExpr node, TypeEnvironment env) {
        TypeEnvironment scope = env.child();
        bindLet(node.getName(), node.isMutable(), node.getTypeAnnotation(), node.getValue(),
                env, scope, node.getLocation());
        return infer(node.getBody(), scope);
    }

    @Override
    public MxType visitBlockExpr(BlockExpr node, TypeEnvironment env) {
        TypeEnvironment scope = env.child();
        for (Statement stmt : node.getStatements()) {
            checkStatement(stmt, scope);
        }
        return node.getTrailing() != null ? infer(node.getTrailing(), scope) : PrimitiveType.UNIT;
    }

    @Override
    public MxType visitIfExpr(IfExpr node, TypeEnvironment env) {
        unify(PrimitiveType.BOOL, infer(node.getCondition(), env), node.getCondition().getLocation());
        MxType thenType = infer(node.getThenBranch(), env);
        if (!node.hasElse()) {
            unify(PrimitiveType.UNIT, thenType, node.getThenBranch().getLocation());
            return PrimitiveType.UNIT;
        }
        MxType elseType = infer(node.getElseBranch(), env);
        unify(thenType, elseType, node.getElseBranch().getLocation());
        return thenType;
    }

    @Override
    public MxType visitMatchExpr(MatchExpr node, TypeEnvironment env) {
        MxType scrutinee = infer(node.getScrutinee(), env);
        MxType result = fresh();
        for (MatchArm arm : node.getArms()) {
            TypeEnvironment scope = env.child();
            patterns.check(arm.getPattern(), scrutinee, scope);
            if (arm.getGuard() != null) {
                unify(PrimitiveType.BOOL, infer(arm.getGuard(), scope), arm.getGuard().getLocation());
            }
            unify(result, infer(arm.getBody(), scope), arm.getBody().getLocation());
        }
        return result;
    }

    @Override
    public MxType visitStructLiteral(StructLiteral node, TypeEnvironment env) {
        StructType struct = env.lookupStruct(node.getStructName());
        if (struct == null) {
            throw TypeCheckException.unknownIdentifier(node.getStructName(), node.getLocation());
        }
        Set<String> given = new HashSet<String>();
        for (FieldInit init : node.getFields()) {
            MxType fieldType = struct.getFieldType(init.getName());
            if (fieldType == null) {
                throw TypeCheckException.unknownIdentifier(struct.getName() + "." + init.getName(),
                        init.getLocation());
            }
            if (!given.add(init.getName())) {
                throw TypeCheckException.arity("field '" + init.getName() + "' given more than once",
                        init.getLocation());
            }
            unify(fieldType, infer(init.getValue(), env), init.getValue().getLocation());
        }
        for (String field : struct.getFields().keySet()) {
            if (!given.contains(field) && !struct.hasDefault(field)) {
                throw TypeCheckException.arity("missing field '" + field + "' in " + struct.getName()
                        + " literal", node.getLocation());
            }
        }
        return struct;
    }

    @Override
    public MxType visitArrayLiteral(ArrayLiteral node, TypeEnvironment env) {
        MxType element = fresh();
        for (Expression e : node.getElements()) {
            unify(element, infer(e, env), e.getLocation());
        }
        return new ArrayType(element);
    }

    /**
     * 等长行的嵌套字面量：统一后的元素类型为 Int 或 Float 时为 Matrix，否则为 [[T]]
     */
    @Override
    public MxType visitMatrixLiteral(MatrixLiteral node, TypeEnvironment env) {
        MxType element = fresh();
        for (List<Expression> row : node.getRows()) {
            for (Expression cell : row) {
                unify(element, infer(cell, env), cell.getLocation());
            }
        }
        MxType resolved = apply(element);
        boolean numeric = resolved == PrimitiveType.INT || resolved == PrimitiveType.FLOAT;
        annotations.recordMatrixDecision(node, numeric);
        if (numeric) {
            return new MatrixType(resolved);
        }
        return new ArrayType(new ArrayType(element));
    }

    @Override
    public MxType visitRangeExpr(RangeExpr node, TypeEnvironment env) {
        unify(PrimitiveType.INT, infer(node.getStart(), env), node.getStart().getLocation());
        unify(PrimitiveType.INT, infer(node.getEnd(), env), node.getEnd().getLocation());
        return new ArrayType(PrimitiveType.INT);
    }

    @Override
    public MxType visitComprehensionExpr(ComprehensionExpr node, TypeEnvironment env) {
        TypeEnvironment scope = env;
        for (ComprehensionClause clause : node.getClauses()) {
            MxType type = infer(clause.getExpression(), scope);
            if (clause.isGenerator()) {
                TypeVariable element = fresh();
                unify(new ArrayType(element), type, clause.getExpression().getLocation());
                scope = scope.child();
                scope.define(clause.getVariable(), TypeScheme.mono(element), false);
            } else {
                unify(PrimitiveType.BOOL, type, clause.getExpression().getLocation());
            }
        }
        return new ArrayType(infer(node.getElement(), scope));
    }

    /** 顺序执行：语句在当前环境中检查，绑定在之后可见 */
    @Override
    public MxType visitParallelExpr(ParallelExpr node, TypeEnvironment env) {
        MxType result = PrimitiveType.UNIT;
        for (Statement stmt : node.getStatements()) {
            result = checkStatement(stmt, env);
        }
        return result;
    }

    @Override
    public MxType visitSpawnExpr(SpawnExpr node, TypeEnvironment env) {
        return OpaqueType.task(infer(node.getBody(), env));
    }

    @Override
    public MxType visitWaitExpr(WaitExpr node, TypeEnvironment env) {
        MxType target = prune(infer(node.getTarget(), env));
        SourceLocation loc = node.getTarget().getLocation();
        if (target instanceof ArrayType) {
            TypeVariable result = fresh();
            unify(OpaqueType.task(result), ((ArrayType) target).getElementType(), loc);
            return new ArrayType(result);
        }
        if (target instanceof OpaqueType || target instanceof TypeVariable) {
            TypeVariable result = fresh();
            unify(OpaqueType.task(result), target, loc);
            return result;
        }
        throw TypeCheckException.mismatch("a task or an array of tasks",
                apply(target).toDisplayString(), loc);
    }
}
