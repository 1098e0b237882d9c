package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.TypeScheme;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 内置签名文本解析测试
 */
class SchemeParserTest {

    @Test
    @DisplayName("单态签名")
    void testMonomorphic() {
        TypeScheme scheme = SchemeParser.parse("(Float, Float) -> Float");
        assertFalse(scheme.isPolymorphic());
        assertEquals(2, scheme.getArity());
        assertEquals("(Float, Float) -> Float", scheme.toDisplayString());
    }

    @Test
    @DisplayName("带约束的多态签名")
    void testConstrained() {
        TypeScheme scheme = SchemeParser.parse("Num a => (a) -> a");
        assertEquals(1, scheme.getQuantified().size());
        assertEquals("Num a => (a) -> a", scheme.toDisplayString());
    }

    @Test
    @DisplayName("高阶签名按出现顺序命名变量")
    void testHigherOrder() {
        TypeScheme scheme = SchemeParser.parse("([x], (x) -> y) -> [y]");
        assertEquals(2, scheme.getQuantified().size());
        assertEquals("([a], (a) -> b) -> [b]", scheme.toDisplayString());
    }

    @Test
    @DisplayName("Matrix 元素隐含 Num 约束")
    void testMatrixElement() {
        assertEquals("Num a => (Matrix<a>) -> Matrix<a>",
                SchemeParser.parse("(Matrix<a>) -> Matrix<a>").toDisplayString());
    }

    @Test
    @DisplayName("句柄类型")
    void testOpaque() {
        assertEquals("(QuantumCircuit, Int) -> QuantumCircuit",
                SchemeParser.parse("(QuantumCircuit, Int) -> QuantumCircuit").toDisplayString());
    }

    @Test
    @DisplayName("约束了未出现的变量")
    void testUnusedConstraint() {
        assertThrows(IllegalArgumentException.class, () -> SchemeParser.parse("Num b => (a) -> a"));
    }
}
