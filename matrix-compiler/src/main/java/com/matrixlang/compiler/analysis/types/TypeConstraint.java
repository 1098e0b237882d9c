package com.matrixlang.compiler.analysis.types;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 类型变量上的约束：允许的形状集合（运算符约束）加上必须具备实例的类型类集合。
 *
 * <p>内置约束名：Num (Int|Float)、Arith (Num|Matrix)、Addable (Arith|String)、Ord (Int|Float|String)。
 * 其他名字视为用户类型类。</p>
 */
public final class TypeConstraint {

    public static final TypeConstraint NONE = new TypeConstraint(null, Collections.<String>emptySet());
    public static final TypeConstraint NUM = shapes(EnumSet.of(TypeShape.INT, TypeShape.FLOAT));
    public static final TypeConstraint ARITH = shapes(EnumSet.of(TypeShape.INT, TypeShape.FLOAT, TypeShape.MATRIX));
    public static final TypeConstraint ADDABLE = shapes(EnumSet.allOf(TypeShape.class));
    public static final TypeConstraint ORD = shapes(EnumSet.of(TypeShape.INT, TypeShape.FLOAT, TypeShape.STRING));

    // null 表示不限制形状
    private final Set<TypeShape> shapes;
    private final Set<String> classes;

    private TypeConstraint(Set<TypeShape> shapes, Set<String> classes) {
        this.shapes = shapes != null ? Collections.unmodifiableSet(shapes) : null;
        this.classes = Collections.unmodifiableSet(classes);
    }

    private static TypeConstraint shapes(EnumSet<TypeShape> shapes) {
        return new TypeConstraint(shapes, Collections.<String>emptySet());
    }

    public static TypeConstraint typeclass(String className) {
        return new TypeConstraint(null, Collections.singleton(className));
    }

    /** 按约束名解析：内置形状约束或类型类 */
    public static TypeConstraint named(String name) {
        switch (name) {
            case "Num": return NUM;
            case "Arith": return ARITH;
            case "Addable": return ADDABLE;
            case "Ord": return ORD;
            default: return typeclass(name);
        }
    }

    public Set<TypeShape> getShapes() {
        return shapes;
    }

    public Set<String> getClasses() {
        return classes;
    }

    public boolean isNone() {
        return shapes == null && classes.isEmpty();
    }

    /** 形状集合为空：没有类型能满足 */
    public boolean isUnsatisfiable() {
        return shapes != null && shapes.isEmpty();
    }

    public boolean allowsShape(TypeShape shape) {
        return shapes == null || (shape != null && shapes.contains(shape));
    }

    /** 合并两个约束：形状取交集，类型类取并集 */
    public TypeConstraint merge(TypeConstraint other) {
        if (other == null || other.isNone()) return this;
        if (isNone()) return other;
        Set<TypeShape> mergedShapes;
        if (shapes == null) {
            mergedShapes = other.shapes;
        } else if (other.shapes == null) {
            mergedShapes = shapes;
        } else {
            mergedShapes = EnumSet.noneOf(TypeShape.class);
            mergedShapes.addAll(shapes);
            mergedShapes.retainAll(other.shapes);
        }
        Set<String> mergedClasses = new TreeSet<String>(classes);
        mergedClasses.addAll(other.classes);
        return new TypeConstraint(mergedShapes, mergedClasses);
    }

    /** 诊断中的描述，如 "a numeric type (Int or Float)" */
    public String describeShapes() {
        if (shapes == null) return "any type";
        if (shapes.equals(NUM.shapes)) return "a numeric type (Int or Float)";
        if (shapes.equals(ARITH.shapes)) return "a numeric or matrix type";
        if (shapes.equals(ADDABLE.shapes)) return "a numeric, matrix or String type";
        if (shapes.equals(ORD.shapes)) return "an ordered type (Int, Float or String)";
        return "one of " + shapes;
    }

    /** 方案显示用的约束前缀，如 "Num a, Show a" */
    public String describeFor(String variableName) {
        StringBuilder sb = new StringBuilder();
        if (shapes != null) {
            sb.append(shapeClassName()).append(' ').append(variableName);
        }
        for (String cls : classes) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(cls).append(' ').append(variableName);
        }
        return sb.toString();
    }

    private String shapeClassName() {
        if (shapes.equals(NUM.shapes)) return "Num";
        if (shapes.equals(ARITH.shapes)) return "Arith";
        if (shapes.equals(ADDABLE.shapes)) return "Addable";
        if (shapes.equals(ORD.shapes)) return "Ord";
        return shapes.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeConstraint)) return false;
        TypeConstraint that = (TypeConstraint) o;
        return Objects.equals(shapes, that.shapes) && classes.equals(that.classes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shapes, classes);
    }
}
