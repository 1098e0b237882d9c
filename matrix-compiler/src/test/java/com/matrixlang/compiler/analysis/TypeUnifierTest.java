package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.*;
import com.matrixlang.compiler.ast.SourceLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TypeUnifier 单元测试
 */
class TypeUnifierTest {

    private static final SourceLocation LOC = SourceLocation.at(1, 1);

    private TypeUnifier unifier;

    @BeforeEach
    void setUp() {
        unifier = new TypeUnifier();
    }

    private static FunctionType fn(MxType param, MxType result) {
        return new FunctionType(Collections.singletonList(param), result);
    }

    @Test
    @DisplayName("变量绑定后 apply 得到具体类型")
    void testBindVariable() {
        TypeVariable a = unifier.fresh();
        TypeVariable b = unifier.fresh();
        unifier.unify(fn(a, b), fn(PrimitiveType.INT, new ArrayType(a)), LOC);
        assertEquals(PrimitiveType.INT, unifier.apply(a));
        assertEquals("[Int]", unifier.apply(b).toDisplayString());
    }

    @Test
    @DisplayName("出现检查拒绝无限类型而不是死循环")
    void testOccursCheck() {
        TypeVariable a = unifier.fresh();
        TypeCheckException e = assertThrows(TypeCheckException.class,
                () -> unifier.unify(a, new ArrayType(a), LOC));
        assertEquals(TypeErrorKind.InfiniteType, e.getKind());

        TypeVariable b = unifier.fresh();
        TypeVariable c = unifier.fresh();
        unifier.unify(b, fn(c, PrimitiveType.INT), LOC);
        assertEquals(TypeErrorKind.InfiniteType,
                assertThrows(TypeCheckException.class, () -> unifier.unify(c, new ArrayType(b), LOC)).getKind());
    }

    @Test
    @DisplayName("同一变量与自身合一成功")
    void testSameVariable() {
        TypeVariable a = unifier.fresh();
        unifier.unify(a, a, LOC);
        assertEquals(a, unifier.apply(a));
    }

    @Test
    @DisplayName("函数参数个数不同")
    void testFunctionArity() {
        FunctionType two = new FunctionType(Arrays.<MxType>asList(PrimitiveType.INT, PrimitiveType.INT), PrimitiveType.INT);
        TypeCheckException e = assertThrows(TypeCheckException.class,
                () -> unifier.unify(two, fn(PrimitiveType.INT, PrimitiveType.INT), LOC));
        assertEquals(TypeErrorKind.ArityMismatch, e.getKind());
    }

    @Test
    @DisplayName("嵌套不匹配报告外层类型")
    void testNestedMismatch() {
        TypeCheckException e = assertThrows(TypeCheckException.class,
                () -> unifier.unify(new ArrayType(PrimitiveType.INT), new ArrayType(PrimitiveType.STRING), LOC));
        assertEquals("[Int]", e.getSubject());
        assertEquals("[String]", e.getFound());
    }

    @Test
    @DisplayName("约束在变量间传播并在绑定时检查")
    void testConstraintPropagation() {
        TypeVariable a = unifier.fresh(TypeConstraint.NUM);
        TypeVariable b = unifier.fresh();
        unifier.unify(a, b, LOC);
        assertEquals(TypeErrorKind.Mismatch, assertThrows(TypeCheckException.class,
                () -> unifier.unify(b, PrimitiveType.STRING, LOC)).getKind());
        unifier.unify(b, PrimitiveType.FLOAT, LOC);
        assertEquals(PrimitiveType.FLOAT, unifier.apply(a));
    }

    @Test
    @DisplayName("约束取交集")
    void testConstraintIntersection() {
        TypeVariable a = unifier.fresh(TypeConstraint.ORD);
        TypeVariable b = unifier.fresh(TypeConstraint.ARITH);
        unifier.unify(a, b, LOC);
        // Ord 与 Arith 的交集只剩数值类型
        assertEquals(TypeErrorKind.Mismatch, assertThrows(TypeCheckException.class,
                () -> unifier.unify(b, new MatrixType(PrimitiveType.INT), LOC)).getKind());
        assertThrows(TypeCheckException.class, () -> unifier.unify(b, PrimitiveType.STRING, LOC));
        unifier.unify(a, PrimitiveType.INT, LOC);
    }

    @Test
    @DisplayName("矩阵满足 Arith 时元素必须是数值")
    void testMatrixElementNumeric() {
        TypeVariable e = unifier.fresh();
        unifier.constrain(new MatrixType(e), TypeConstraint.ARITH, LOC);
        assertThrows(TypeCheckException.class, () -> unifier.unify(e, PrimitiveType.BOOL, LOC));
    }

    @Test
    @DisplayName("类型类约束查询实例")
    void testTypeclassConstraint() {
        unifier.setInstanceLookup((cls, head) -> cls.equals("Show") && head.equals("Int"));
        TypeVariable a = unifier.fresh(TypeConstraint.typeclass("Show"));
        TypeVariable b = unifier.fresh(TypeConstraint.typeclass("Show"));
        unifier.unify(a, PrimitiveType.INT, LOC);
        assertThrows(TypeCheckException.class, () -> unifier.unify(b, PrimitiveType.FLOAT, LOC));
    }

    @Test
    @DisplayName("快照恢复撤销绑定")
    void testSnapshot() {
        TypeVariable a = unifier.fresh();
        TypeUnifier.Snapshot snapshot = unifier.snapshot();
        unifier.unify(a, PrimitiveType.INT, LOC);
        unifier.restore(snapshot);
        assertEquals(a, unifier.apply(a));
        unifier.unify(a, PrimitiveType.STRING, LOC);
        assertEquals(PrimitiveType.STRING, unifier.apply(a));
    }
}
