package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.*;
import com.matrixlang.compiler.ast.SourceLocation;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 合一器：持有类型变量计数器、当前替换和类型变量上的约束。
 *
 * <p>每个检查会话持有一个实例。绑定前执行出现检查，绑定时把变量上的约束传播到目标类型。</p>
 */
public final class TypeUnifier {

    /** 类型类实例查询 */
    public interface InstanceLookup {
        boolean hasInstance(String typeclassName, String headName);
    }

    private int nextId = 0;
    private Map<Integer, MxType> bindings = new HashMap<Integer, MxType>();
    private Map<Integer, TypeConstraint> constraints = new HashMap<Integer, TypeConstraint>();
    private InstanceLookup instances = new InstanceLookup() {
        @Override
        public boolean hasInstance(String typeclassName, String headName) {
            return false;
        }
    };

    public void setInstanceLookup(InstanceLookup instances) {
        this.instances = instances;
    }

    // ============ 类型变量 ============

    public TypeVariable fresh() {
        return new TypeVariable(nextId++);
    }

    public TypeVariable fresh(TypeConstraint constraint) {
        TypeVariable var = fresh();
        if (constraint != null && !constraint.isNone()) {
            constraints.put(var.getId(), constraint);
        }
        return var;
    }

    /** 已分配的类型变量数 */
    public int getVariableCount() {
        return nextId;
    }

    public TypeConstraint constraintOf(TypeVariable var) {
        TypeConstraint c = constraints.get(var.getId());
        return c != null ? c : TypeConstraint.NONE;
    }

    // ============ 替换 ============

    /** 只解析最外层的变量绑定 */
    public MxType prune(MxType type) {
        while (type instanceof TypeVariable) {
            MxType bound = bindings.get(((TypeVariable) type).getId());
            if (bound == null) break;
            type = bound;
        }
        return type;
    }

    /** 完全应用当前替换 */
    public MxType apply(MxType type) {
        return new TypeSubstitution(bindings, true).apply(type);
    }

    /** 应用替换后仍自由的类型变量 id（按出现顺序） */
    public Set<Integer> freeVariables(MxType type) {
        Set<Integer> result = new LinkedHashSet<Integer>();
        collectFree(apply(type), result);
        return result;
    }

    private static void collectFree(MxType type, Set<Integer> out) {
        if (type instanceof TypeVariable) {
            out.add(((TypeVariable) type).getId());
        } else if (type instanceof ArrayType) {
            collectFree(((ArrayType) type).getElementType(), out);
        } else if (type instanceof MatrixType) {
            collectFree(((MatrixType) type).getElementType(), out);
        } else if (type instanceof FunctionType) {
            FunctionType fn = (FunctionType) type;
            for (MxType p : fn.getParamTypes()) collectFree(p, out);
            collectFree(fn.getReturnType(), out);
        } else if (type instanceof OpaqueType) {
            for (MxType arg : ((OpaqueType) type).getTypeArgs()) collectFree(arg, out);
        }
    }

    // ============ 合一 ============

    /**
     * 合一 expected 与 found；失败抛出 Mismatch / ArityMismatch / InfiniteType
     */
    public void unify(MxType expected, MxType found, SourceLocation location) {
        if (!unifyInner(expected, found, location)) {
            throw TypeCheckException.mismatch(apply(expected).toDisplayString(),
                    apply(found).toDisplayString(), location);
        }
    }

    private boolean unifyInner(MxType expected, MxType found, SourceLocation location) {
        MxType a = prune(expected);
        MxType b = prune(found);

        if (a instanceof TypeVariable && b instanceof TypeVariable
                && ((TypeVariable) a).getId() == ((TypeVariable) b).getId()) {
            return true;
        }
        if (a instanceof TypeVariable) {
            bind((TypeVariable) a, b, location);
            return true;
        }
        if (b instanceof TypeVariable) {
            bind((TypeVariable) b, a, location);
            return true;
        }

        if (a instanceof PrimitiveType || b instanceof PrimitiveType) {
            return a == b;
        }
        if (a instanceof ArrayType && b instanceof ArrayType) {
            return unifyInner(((ArrayType) a).getElementType(), ((ArrayType) b).getElementType(), location);
        }
        if (a instanceof MatrixType && b instanceof MatrixType) {
            return unifyInner(((MatrixType) a).getElementType(), ((MatrixType) b).getElementType(), location);
        }
        if (a instanceof FunctionType && b instanceof FunctionType) {
            FunctionType fa = (FunctionType) a;
            FunctionType fb = (FunctionType) b;
            if (fa.getArity() != fb.getArity()) {
                throw TypeCheckException.arity("expected a function of " + fa.getArity()
                        + " parameter(s), found " + apply(fb).toDisplayString(), location);
            }
            for (int i = 0; i < fa.getArity(); i++) {
                if (!unifyInner(fa.getParamTypes().get(i), fb.getParamTypes().get(i), location)) {
                    return false;
                }
            }
            return unifyInner(fa.getReturnType(), fb.getReturnType(), location);
        }
        if (a instanceof StructType && b instanceof StructType) {
            return a.equals(b);
        }
        if (a instanceof OpaqueType && b instanceof OpaqueType) {
            OpaqueType oa = (OpaqueType) a;
            OpaqueType ob = (OpaqueType) b;
            if (!oa.getName().equals(ob.getName()) || oa.getTypeArgs().size() != ob.getTypeArgs().size()) {
                return false;
            }
            List<MxType> argsA = oa.getTypeArgs();
            List<MxType> argsB = ob.getTypeArgs();
            for (int i = 0; i < argsA.size(); i++) {
                if (!unifyInner(argsA.get(i), argsB.get(i), location)) return false;
            }
            return true;
        }
        return false;
    }

    private void bind(TypeVariable var, MxType type, SourceLocation location) {
        if (occurs(var.getId(), type)) {
            throw new TypeCheckException(TypeErrorKind.InfiniteType,
                    "cannot construct infinite type " + var.toDisplayString()
                            + " = " + apply(type).toDisplayString(),
                    location, var.toDisplayString(), null);
        }
        // 约束先检查，失败时变量保持未绑定
        TypeConstraint constraint = constraints.get(var.getId());
        if (constraint != null) {
            constrain(type, constraint, location);
            constraints.remove(var.getId());
        }
        bindings.put(var.getId(), type);
    }

    /** 出现检查：var 是否出现在 type（应用替换后）中 */
    public boolean occurs(int varId, MxType type) {
        MxType t = prune(type);
        if (t instanceof TypeVariable) {
            return ((TypeVariable) t).getId() == varId;
        }
        if (t instanceof ArrayType) {
            return occurs(varId, ((ArrayType) t).getElementType());
        }
        if (t instanceof MatrixType) {
            return occurs(varId, ((MatrixType) t).getElementType());
        }
        if (t instanceof FunctionType) {
            FunctionType fn = (FunctionType) t;
            for (MxType p : fn.getParamTypes()) {
                if (occurs(varId, p)) return true;
            }
            return occurs(varId, fn.getReturnType());
        }
        if (t instanceof OpaqueType) {
            for (MxType arg : ((OpaqueType) t).getTypeArgs()) {
                if (occurs(varId, arg)) return true;
            }
        }
        return false;
    }

    // ============ 约束 ============

    /**
     * 要求 type 满足 constraint；type 仍为变量时约束被合并记录，留待绑定时检查
     */
    public void constrain(MxType type, TypeConstraint constraint, SourceLocation location) {
        if (constraint == null || constraint.isNone()) return;
        MxType t = prune(type);
        if (t instanceof TypeVariable) {
            int id = ((TypeVariable) t).getId();
            TypeConstraint existing = constraints.get(id);
            TypeConstraint merged = existing != null ? existing.merge(constraint) : constraint;
            if (merged.isUnsatisfiable()) {
                throw TypeCheckException.mismatch(constraint.describeShapes(),
                        "a type restricted to " + existing.describeShapes(), location);
            }
            constraints.put(id, merged);
            return;
        }

        TypeShape shape = TypeShape.of(t);
        if (!constraint.allowsShape(shape)) {
            throw TypeCheckException.mismatch(constraint.describeShapes(),
                    apply(t).toDisplayString(), location);
        }
        if (shape == TypeShape.MATRIX && constraint.getShapes() != null) {
            constrain(((MatrixType) t).getElementType(), TypeConstraint.NUM, location);
        }
        for (String cls : constraint.getClasses()) {
            if (!instances.hasInstance(cls, t.getHeadName())) {
                throw TypeCheckException.mismatch("an instance of " + cls,
                        apply(t).toDisplayString(), location);
            }
        }
    }

    // ============ 回滚 ============

    /** 当前替换与约束的快照（计数器不回退） */
    public Snapshot snapshot() {
        return new Snapshot(new HashMap<Integer, MxType>(bindings),
                new HashMap<Integer, TypeConstraint>(constraints));
    }

    public void restore(Snapshot snapshot) {
        this.bindings = new HashMap<Integer, MxType>(snapshot.bindings);
        this.constraints = new HashMap<Integer, TypeConstraint>(snapshot.constraints);
    }

    public static final class Snapshot {
        private final Map<Integer, MxType> bindings;
        private final Map<Integer, TypeConstraint> constraints;

        private Snapshot(Map<Integer, MxType> bindings, Map<Integer, TypeConstraint> constraints) {
            this.bindings = bindings;
            this.constraints = constraints;
        }
    }
}
