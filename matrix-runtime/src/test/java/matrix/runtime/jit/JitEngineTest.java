package matrix.runtime.jit;

import com.matrixlang.compiler.ast.expr.LambdaExpr;
import matrix.runtime.*;
import matrix.runtime.interpreter.MxClosure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JIT 与解释执行的一致性测试
 */
class JitEngineTest {

    private Session jit;
    private Session plain;

    @BeforeEach
    void setUp() {
        jit = new Session(SessionConfig.builder().replMode(true).jitEnabled(true).maxCallDepth(100).build());
        plain = new Session(SessionConfig.builder().replMode(true).maxCallDepth(100).build());
    }

    private void define(String source) {
        jit.evalRepl(source);
        plain.evalRepl(source);
    }

    /** 在两个会话中求值同一段程序，结果必须一致 */
    private MxValue both(String source) {
        MxValue compiled = jit.evalRepl(source).getValue();
        MxValue interpreted = plain.evalRepl(source).getValue();
        assertEquals(interpreted.toString(), compiled.toString(), source);
        assertEquals(interpreted.getTypeName(), compiled.getTypeName(), source);
        return compiled;
    }

    private LambdaExpr lambdaOf(String name) {
        return ((MxClosure) jit.getInterpreter().getGlobals().lookup(name)).getLambda();
    }

    @Nested
    @DisplayName("编译执行")
    class CompiledTests {

        @Test
        @DisplayName("递归函数的结果与解释执行一致")
        void testFactorial() {
            define("fn fact(n) = if n <= 1 then 1 else n * fact(n - 1)");
            assertEquals(3628800, both("fact(10)").asInt());

            JitDecision decision = jit.getInterpreter().getJitEngine().decisionOf(lambdaOf("fact"));
            assertNotNull(decision);
            assertTrue(decision.isEligible());
        }

        @Test
        @DisplayName("浮点、比较与逻辑运算")
        void testMixedOperations() {
            define("let hyp2 = (a, b) => a * a + b * b");
            assertEquals(25.0, both("hyp2(3.0, 4.0)").asFloat());
            define("let inside = (x, lo, hi) => x >= lo && x <= hi");
            assertTrue(both("inside(5, 1, 10)").asBool());
            assertFalse(both("inside(0.5, 1.0, 10.0)").asBool());
        }

        @Test
        @DisplayName("JIT 关闭时没有引擎")
        void testDisabled() {
            assertNull(plain.getInterpreter().getJitEngine());
        }
    }

    @Nested
    @DisplayName("回退与错误")
    class FallbackTests {

        @Test
        @DisplayName("非数值实参回退到解释执行")
        void testBailout() {
            define("let twice = (x) => x + x");
            assertEquals("abab", both("twice(\"ab\")").asString());
            assertTrue(both("twice([[1, 2]])").isMatrix());
            assertEquals(4, both("twice(2)").asInt());
        }

        @Test
        @DisplayName("不可编译的函数照常解释执行")
        void testIneligible() {
            define("let greet = (name) => \"hi \" + name");
            assertEquals("hi bob", both("greet(\"bob\")").asString());
            assertFalse(jit.getInterpreter().getJitEngine().decisionOf(lambdaOf("greet")).isEligible());
        }

        @Test
        @DisplayName("运行时错误与解释执行相同")
        void testSameErrors() {
            jit.evalRepl("let div = (a, b) => a / b");
            MxRuntimeException e = assertThrows(MxRuntimeException.class, () -> jit.evalRepl("div(1, 0)"));
            assertEquals(RuntimeErrorKind.DivisionByZero, e.getKind());

            jit.evalRepl("fn forever(n) = forever(n + 1)");
            MxRuntimeException depth = assertThrows(MxRuntimeException.class, () -> jit.evalRepl("forever(0)"));
            assertEquals(RuntimeErrorKind.CallDepthExceeded, depth.getKind());
            assertEquals("forever", depth.getSubject());
            assertEquals(7, jit.evalRepl("div(14, 2)").getValue().asInt());
        }
    }
}
