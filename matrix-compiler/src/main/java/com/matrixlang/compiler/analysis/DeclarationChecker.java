package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.*;
import com.matrixlang.compiler.ast.decl.*;
import com.matrixlang.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 声明检查：结构体、类型类、实例、模块与导入
 */
final class DeclarationChecker {

    /** 内置函数总在作用域内，导入这些名字不做任何事 */
    static final Set<String> BUILTIN_MODULES = Collections.unmodifiableSet(
            new HashSet<String>(Arrays.asList("std", "math", "io", "physics", "quantum")));

    private final TypeChecker checker;

    DeclarationChecker(TypeChecker checker) {
        this.checker = checker;
    }

    // ============ struct ============

    void checkStruct(StructDecl node, TypeEnvironment env) {
        StructType struct = new StructType(node.getName());
        // 先注册，字段类型可以引用结构体自身
        env.defineStruct(struct);
        TypeResolver resolver = checker.resolver(env);
        for (StructField field : node.getFields()) {
            if (struct.getFieldType(field.getName()) != null) {
                throw TypeCheckException.arity("duplicate field '" + field.getName() + "' in struct "
                        + node.getName(), field.getLocation());
            }
            MxType type = resolver.resolve(field.getType());
            if (field.getDefaultValue() != null) {
                checker.unify(type, checker.infer(field.getDefaultValue(), env),
                        field.getDefaultValue().getLocation());
            }
            struct.addField(field.getName(), type, field.getDefaultValue() != null);
        }
    }

    // ============ typeclass ============

    /**
     * 每个方法成为一个方案：类参数被量化并带有该类型类的约束
     */
    void checkTypeclass(TypeclassDecl node, TypeEnvironment env) {
        TypeclassInfo info = new TypeclassInfo(node.getName(), node.getTypeParameter());
        for (MethodSignature method : node.getMethods()) {
            if (info.getMethods().containsKey(method.getName())) {
                throw TypeCheckException.arity("duplicate method '" + method.getName() + "' in typeclass "
                        + node.getName(), method.getLocation());
            }
            TypeVariable classVar = checker.fresh();
            TypeResolver resolver = checker.resolver(env);
            resolver.bindName(node.getTypeParameter(), classVar);
            MxType type = resolver.resolve(method.getType());

            List<TypeVariable> quantified = new ArrayList<TypeVariable>();
            Map<Integer, TypeConstraint> constraints = new LinkedHashMap<Integer, TypeConstraint>();
            for (Integer id : checker.getUnifier().freeVariables(type)) {
                quantified.add(new TypeVariable(id));
            }
            if (!quantified.contains(classVar)) {
                quantified.add(0, classVar);
            }
            constraints.put(classVar.getId(), TypeConstraint.typeclass(node.getName()));
            TypeScheme scheme = new TypeScheme(quantified, constraints, type);

            info.addMethod(method.getName(), scheme,
                    TypeclassInfo.dispatchIndexOf(method.getType(), node.getTypeParameter()));
            env.define(method.getName(), scheme, false);
        }
        env.defineTypeclass(info);
    }

    // ============ instance ============

    void checkInstance(InstanceDecl node, TypeEnvironment env) {
        TypeclassInfo info = env.lookupTypeclass(node.getTypeclassName());
        if (info == null) {
            throw TypeCheckException.unknownIdentifier(node.getTypeclassName(), node.getLocation());
        }
        MxType instanceType = checker.resolver(env).resolve(node.getInstanceType());
        String head = instanceType.getHeadName();
        if (head == null) {
            throw TypeCheckException.mismatch("a concrete instance type",
                    instanceType.toDisplayString(), node.getInstanceType().getLocation());
        }
        // 实例先登记，方法体内可以递归使用本实例
        checker.getCurrentLayer().addInstance(info.getName(), head);

        Set<String> implemented = new HashSet<String>();
        for (MethodImpl impl : node.getMethods()) {
            TypeScheme scheme = info.getMethods().get(impl.getName());
            if (scheme == null) {
                throw TypeCheckException.unknownIdentifier(info.getName() + "." + impl.getName(),
                        impl.getLocation());
            }
            if (!implemented.add(impl.getName())) {
                throw TypeCheckException.arity("method '" + impl.getName() + "' implemented more than once",
                        impl.getLocation());
            }
            Map<Integer, MxType> fixed = new HashMap<Integer, MxType>();
            fixed.put(classVariableOf(scheme, info).getId(), instanceType);
            MxType expected = checker.instantiate(scheme, fixed);
            checker.unify(expected, checker.infer(impl.getValue(), env), impl.getValue().getLocation());
        }
        for (String method : info.getMethods().keySet()) {
            if (!implemented.contains(method)) {
                throw TypeCheckException.arity("instance " + info.getName() + "<" + instanceType.toDisplayString()
                        + "> is missing method '" + method + "'", node.getLocation());
            }
        }
    }

    private static TypeVariable classVariableOf(TypeScheme scheme, TypeclassInfo info) {
        for (TypeVariable var : scheme.getQuantified()) {
            if (scheme.getConstraint(var.getId()).getClasses().contains(info.getName())) {
                return var;
            }
        }
        throw new IllegalStateException("typeclass method without class variable");
    }

    // ============ module / import ============

    void checkModule(ModuleDecl node, TypeEnvironment env) {
        TypeEnvironment body = env.child();
        for (Statement stmt : node.getBody()) {
            checker.checkStatement(stmt, body);
        }
        Map<String, TypeScheme> members = new LinkedHashMap<String, TypeScheme>();
        for (Map.Entry<String, TypeEnvironment.Binding> e : body.getLocalBindings().entrySet()) {
            members.put(e.getKey(), e.getValue().getScheme());
        }
        env.defineModule(new ModuleInfo(node.getName(), members));
    }

    void checkImport(ImportDecl node, TypeEnvironment env) {
        ModuleInfo module = env.lookupModule(node.getModuleName());
        if (module == null) {
            if (BUILTIN_MODULES.contains(node.getModuleName())) return;
            throw TypeCheckException.unknownIdentifier(node.getModuleName(), node.getLocation());
        }
        if (node.isWildcard()) {
            for (Map.Entry<String, TypeScheme> e : module.getMembers().entrySet()) {
                env.define(e.getKey(), e.getValue(), false);
            }
            return;
        }
        for (String item : node.getItems()) {
            TypeScheme member = module.getMember(item);
            if (member == null) {
                throw TypeCheckException.unknownIdentifier(module.getName() + "." + item, node.getLocation());
            }
            env.define(item, member, false);
        }
    }
}
