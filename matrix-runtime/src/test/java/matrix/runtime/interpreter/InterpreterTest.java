package matrix.runtime.interpreter;

import com.matrixlang.compiler.analysis.TypeCheckException;
import com.matrixlang.compiler.ast.Program;
import com.matrixlang.compiler.parser.Parser;
import matrix.runtime.*;
import matrix.runtime.interpreter.builtin.BuiltinRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 解释器语义测试
 */
class InterpreterTest {

    private Session session;

    @BeforeEach
    void setUp() {
        session = new Session(SessionConfig.builder().replMode(true).maxCallDepth(200).build());
    }

    private MxValue eval(String source) {
        return session.evalRepl(source).getValue();
    }

    private MxRuntimeException runtimeError(String source) {
        return assertThrows(MxRuntimeException.class, () -> eval(source));
    }

    private static List<Long> ints(MxValue array) {
        List<Long> result = new ArrayList<Long>();
        for (MxValue v : array.asArray().getElements()) {
            result.add(v.asInt());
        }
        return result;
    }

    @Nested
    @DisplayName("算术与比较")
    class ArithmeticTests {

        @Test
        @DisplayName("整数除法向零截断")
        void testIntDivision() {
            assertEquals(3, eval("7 / 2").asInt());
            assertEquals(-3, eval("-7 / 2").asInt());
            assertEquals(1, eval("7 % 3").asInt());
        }

        @Test
        @DisplayName("最小整数可直接书写")
        void testMinIntLiteral() {
            assertEquals(Long.MIN_VALUE, eval("-9223372036854775808").asInt());
            assertTrue(eval("-9223372036854775807 - 1 == -9223372036854775808").asBool());
            eval("let low = -9223372036854775807 - 1");
            assertEquals("min", eval("match low { -9223372036854775808 => \"min\", _ => \"other\" }").asString());
        }

        @Test
        @DisplayName("幂运算")
        void testPow() {
            assertEquals(512, eval("2 ^ 3 ^ 2").asInt());
            assertEquals(8.0, eval("2.0 ^ 3.0").asFloat());
        }

        @Test
        @DisplayName("字符串拼接与比较")
        void testStrings() {
            assertEquals("ab", eval("\"a\" + \"b\"").asString());
            assertTrue(eval("\"abc\" < \"abd\"").asBool());
            assertTrue(eval("\"x\" == \"x\"").asBool());
        }

        @Test
        @DisplayName("逻辑运算短路")
        void testShortCircuit() {
            assertFalse(eval("false && 1 / 0 == 0").asBool());
            assertTrue(eval("true || 1 / 0 == 0").asBool());
        }

        @Test
        @DisplayName("浮点相等使用容差")
        void testFloatEquality() {
            assertTrue(eval("0.1 + 0.2 == 0.3").asBool());
            assertFalse(eval("0.1 + 0.2 != 0.3").asBool());
        }
    }

    @Nested
    @DisplayName("矩阵与数组")
    class MatrixTests {

        @Test
        @DisplayName("数值元素的等长行构成矩阵")
        void testMatrixLiteral() {
            MxValue m = eval("[[1, 2], [3, 4]]");
            assertTrue(m.isMatrix());
            assertEquals(2, m.asMatrix().getRows());
            assertEquals(4, m.asMatrix().get(1, 1).asInt());
        }

        @Test
        @DisplayName("非数值元素或不等长行保持为嵌套数组")
        void testNestedArrays() {
            assertTrue(eval("[[\"a\"], [\"b\"]]").isArray());
            MxValue ragged = eval("[[1], [2, 3]]");
            assertTrue(ragged.isArray());
            assertEquals(2, ragged.asArray().get(1).asArray().size());
        }

        @Test
        @DisplayName("元素类型不确定时按检查结果构造嵌套数组")
        void testPolymorphicRows() {
            eval("let pair = (a, b) => [[a, b], [b, a]]");
            MxValue v = eval("pair(1, 2)");
            assertTrue(v.isArray());
            assertEquals(2, v.asArray().get(1).asArray().get(0).asInt());
        }

        @Test
        @DisplayName("矩阵乘法、加法与取负")
        void testMatrixArithmetic() {
            MxMatrix product = eval("[[1.0, 2.0]] * [[1.0], [2.0]]").asMatrix();
            assertEquals(1, product.getRows());
            assertEquals(5.0, product.get(0, 0).asFloat());
            MxMatrix sum = eval("[[1, 2], [3, 4]] + [[1, 1], [1, 1]]").asMatrix();
            assertEquals(5, sum.get(1, 1).asInt());
            assertEquals(-1, eval("-[[1, 2]]").asMatrix().get(0, 0).asInt());
        }

        @Test
        @DisplayName("矩阵下标取行")
        void testMatrixIndex() {
            assertThat(ints(eval("[[1, 2], [3, 4]][1]"))).containsExactly(3L, 4L);
        }

        @Test
        @DisplayName("区间与推导式")
        void testRangeAndComprehension() {
            assertThat(ints(eval("0..3"))).containsExactly(0L, 1L, 2L);
            assertThat(ints(eval("1..=3"))).containsExactly(1L, 2L, 3L);
            assertThat(ints(eval("5..1"))).isEmpty();
            assertThat(ints(eval("[x * y | x in [1, 2, 3], y in 1..3, x > y]"))).containsExactly(2L, 3L, 6L);
        }
    }

    @Nested
    @DisplayName("绑定与作用域")
    class ScopeTests {

        @Test
        @DisplayName("let ... in 与块表达式")
        void testLetIn() {
            assertEquals(2, eval("let x = 1 in x + 1").asInt());
            assertEquals(6, eval("{\n let a = 2\n let b = 3\n a * b\n}").asInt());
        }

        @Test
        @DisplayName("块内绑定不泄漏")
        void testBlockScope() {
            eval("let outer = { let inner = 1\n inner + 1 }");
            assertEquals(2, eval("outer").asInt());
            assertThrows(TypeCheckException.class, () -> eval("inner"));
        }

        @Test
        @DisplayName("高阶函数与闭包")
        void testClosures() {
            eval("let make_adder = (n) => (x) => x + n");
            eval("let add3 = make_adder(3)");
            assertEquals(10, eval("add3(7)").asInt());
            assertThat(ints(eval("map([1, 2, 3], add3)"))).containsExactly(4L, 5L, 6L);
            assertEquals(10, eval("fold([1, 2, 3, 4], 0, (acc, x) => acc + x)").asInt());
            assertThat(ints(eval("filter(1..=6, x => x % 2 == 0)"))).containsExactly(2L, 4L, 6L);
        }

        @Test
        @DisplayName("闭包内对可变绑定赋值")
        void testAssignFromClosure() {
            eval("let mut total = 0");
            eval("let bump = () => { total = total + 10 }");
            eval("bump()\nbump()");
            assertEquals(20, eval("total").asInt());
        }
    }

    @Nested
    @DisplayName("结构体与模式匹配")
    class StructTests {

        @BeforeEach
        void declare() {
            eval("struct Point { x: Float, y: Float = 0.0 }");
        }

        @Test
        @DisplayName("字段默认值")
        void testDefaults() {
            MxValue p = eval("Point { x: 1.5 }");
            assertEquals("Point", p.getTypeName());
            assertEquals(0.0, ((MxStruct) p).getField("y").asFloat());
            assertEquals(1.5, eval("let p = Point { x: 1.5, y: 2.0 }\np.x").asFloat());
        }

        @Test
        @DisplayName("结构体、字面量与数组模式")
        void testMatch() {
            eval("let classify = (p) => match p {\n"
                    + "  Point { x: 0.0, y } => y\n"
                    + "  Point { x } if x > 10.0 => 10.0\n"
                    + "  _ => -1.0\n"
                    + "}");
            assertEquals(3.0, eval("classify(Point { x: 0.0, y: 3.0 })").asFloat());
            assertEquals(10.0, eval("classify(Point { x: 20.0 })").asFloat());
            assertEquals(-1.0, eval("classify(Point { x: 5.0 })").asFloat());
            assertEquals(3, eval("match [1, 2] { [a, b] => a + b, _ => 0 }").asInt());
            assertEquals(0, eval("match [1, 2, 3] { [a, b] => a + b, _ => 0 }").asInt());
        }

        @Test
        @DisplayName("守卫引用外部绑定")
        void testGuardWithOuterBinding() {
            eval("let limit = 3");
            assertEquals("big", eval("match 5 { n if n > limit => \"big\", _ => \"small\" }").asString());
            assertEquals("small", eval("match 2 { n if n > limit => \"big\", _ => \"small\" }").asString());
            assertEquals("big", eval("match 5 { n if (n > limit) => \"big\", _ => \"small\" }").asString());

            eval("let ok = false");
            assertEquals(0, eval("match 7 { n if ok => n, _ => 0 }").asInt());
        }

        @Test
        @DisplayName("没有分支匹配时报告 MatchFailure")
        void testMatchFailure() {
            MxRuntimeException e = runtimeError("match 3 { 1 => \"one\", 2 => \"two\" }");
            assertEquals(RuntimeErrorKind.MatchFailure, e.getKind());
            assertEquals("RuntimeError", e.getCategory());
        }
    }

    @Nested
    @DisplayName("类型类与模块")
    class DeclarationTests {

        @Test
        @DisplayName("按参数的运行时类型分派实例方法")
        void testTypeclassDispatch() {
            eval("typeclass Show<T> {\n  show: (T) -> String\n}\n"
                    + "instance Show<Int> {\n  show(x) = \"int \" + to_string(x)\n}\n"
                    + "instance Show<Bool> {\n  show(b) = if b then \"yes\" else \"no\"\n}");
            assertEquals("int 5", eval("show(5)").asString());
            assertEquals("yes", eval("show(true)").asString());
            eval("let describe = (v) => show(v)");
            assertEquals("no", eval("describe(false)").asString());
        }

        @Test
        @DisplayName("模块成员访问与导入")
        void testModules() {
            eval("module Geo {\n  let two = 2\n  area(r) = r * r * 3.0\n}");
            assertEquals(3, eval("Geo.two + 1").asInt());
            assertEquals(3.0, eval("Geo.area(1.0)").asFloat());
            eval("import Geo.{area}");
            assertEquals(12.0, eval("area(2.0)").asFloat());
            assertTrue(eval("import math").isUnit());
        }
    }

    @Nested
    @DisplayName("parallel / spawn / wait")
    class ConcurrencyTests {

        @Test
        @DisplayName("parallel 中的语句按顺序执行，绑定之后可见")
        void testParallel() {
            assertEquals(3, eval("parallel {\n let a = 1\n let b = 2\n}\na + b").asInt());
        }

        @Test
        @DisplayName("spawn 返回句柄，wait 取出结果")
        void testSpawnWait() {
            MxValue handle = eval("spawn (40 + 2)");
            assertInstanceOf(MxHandle.class, handle);
            assertEquals("Task", handle.getTypeName());
            assertEquals(42, eval("wait spawn (40 + 2)").asInt());
            MxValue all = eval("wait [spawn \"a\", spawn \"b\"]");
            assertEquals("a", all.asArray().get(0).asString());
            assertEquals("b", all.asArray().get(1).asString());
        }

        @Test
        @DisplayName("反复 spawn 不会让句柄表增长")
        void testSpawnDoesNotGrowHandleTable() {
            MxValue total = eval("array_sum(wait [spawn (i * 2) | i in 0..1000])");
            assertEquals(999000, total.asInt());
            eval("let t = spawn \"kept\"");
            assertEquals("kept", eval("wait t").asString());
            assertEquals("kept", eval("wait t").asString());
            assertEquals(0, session.getHandles().size());
        }
    }

    @Nested
    @DisplayName("运行时错误")
    class RuntimeErrorTests {

        @Test
        @DisplayName("除零")
        void testDivisionByZero() {
            assertEquals(RuntimeErrorKind.DivisionByZero, runtimeError("10 / 0").getKind());
            assertEquals(RuntimeErrorKind.DivisionByZero, runtimeError("10 % 0").getKind());
            assertEquals(RuntimeErrorKind.DivisionByZero, runtimeError("1.0 / 0.0").getKind());
        }

        @Test
        @DisplayName("下标越界带位置")
        void testIndexOutOfBounds() {
            MxRuntimeException e = runtimeError("let xs = [1, 2, 3]\nxs[5]");
            assertEquals(RuntimeErrorKind.IndexOutOfBounds, e.getKind());
            assertEquals(2, e.getLine());
            assertThat(e.getMessage()).contains("index 5 out of bounds for length 3");
        }

        @Test
        @DisplayName("内置函数错误补上调用位置")
        void testBuiltinErrorLocation() {
            MxRuntimeException e = runtimeError("\n\narray_pop([])");
            assertEquals(RuntimeErrorKind.IndexOutOfBounds, e.getKind());
            assertEquals(3, e.getLine());
        }

        @Test
        @DisplayName("无限递归报告 CallDepthExceeded")
        void testCallDepth() {
            eval("fn forever(n) = forever(n + 1)");
            MxRuntimeException e = runtimeError("forever(0)");
            assertEquals(RuntimeErrorKind.CallDepthExceeded, e.getKind());
            assertEquals("forever", e.getSubject());
            // 出错后会话仍可用
            assertEquals(1, eval("1").asInt());
        }

        @Test
        @DisplayName("默认配置下可以递归到最大深度")
        void testDefaultDepthReachable() {
            Session defaults = new Session(SessionConfig.defaults());
            int depth = SessionConfig.DEFAULT_MAX_CALL_DEPTH - 1;
            String program = "fn down(n) = if n == 0 then 0 else down(n - 1)\n";
            // depth 次调用：down(depth - 1) 到 down(0)
            assertEquals(0, defaults.run(program + "down(" + (depth - 1) + ")", "deep.mx").asInt());

            String sum = "fn total(n) = if n == 0 then 0 else n + total(n - 1)\n";
            assertEquals((long) depth * (depth - 1) / 2,
                    defaults.run(sum + "total(" + (depth - 1) + ")", "sum.mx").asInt());

            MxRuntimeException e = assertThrows(MxRuntimeException.class,
                    () -> defaults.run(program + "down(" + SessionConfig.DEFAULT_MAX_CALL_DEPTH + ")", "over.mx"));
            assertEquals(RuntimeErrorKind.CallDepthExceeded, e.getKind());
            assertThat(e.getMessage()).contains("maximum call depth");
        }

        @Test
        @DisplayName("JIT 路径同样可以递归到最大深度")
        void testDefaultDepthReachableWithJit() {
            Session jit = new Session(SessionConfig.builder().jitEnabled(true).build());
            int depth = SessionConfig.DEFAULT_MAX_CALL_DEPTH - 1;
            assertEquals(0, jit.run("fn down(n) = if n == 0 then 0 else down(n - 1)\ndown(" + (depth - 1) + ")",
                    "deep.mx").asInt());
        }
    }

    @Nested
    @DisplayName("直接使用解释器")
    class DirectTests {

        @Test
        @DisplayName("未经检查的矩阵字面量按元素类型决定")
        void testWithoutAnnotations() {
            Interpreter interpreter = new Interpreter(BuiltinRegistry.withStandardLibrary(), SessionConfig.defaults());
            Program program = new Parser("[[1.0, 2.0], [3.0, 4.0]]", "<test>").parse();
            Interpreter.Evaluation evaluation = interpreter.evaluate(program, null);
            assertTrue(evaluation.getValue().isMatrix());
        }

        @Test
        @DisplayName("未提交的求值对之后不可见")
        void testUncommitted() {
            Interpreter interpreter = new Interpreter(BuiltinRegistry.withStandardLibrary(), SessionConfig.defaults());
            interpreter.evaluate(new Parser("let a = 1", "<test>").parse(), null);
            MxRuntimeException e = assertThrows(MxRuntimeException.class,
                    () -> interpreter.evaluate(new Parser("a", "<test>").parse(), null));
            assertEquals(RuntimeErrorKind.UndefinedVariable, e.getKind());
        }

        @Test
        @DisplayName("基于旧环境的求值不能提交")
        void testStaleCommit() {
            Interpreter interpreter = new Interpreter(BuiltinRegistry.withStandardLibrary(), SessionConfig.defaults());
            Interpreter.Evaluation first = interpreter.evaluate(new Parser("let a = 1", "<test>").parse(), null);
            interpreter.commit(interpreter.evaluate(new Parser("let b = 2", "<test>").parse(), null));
            assertThrows(IllegalStateException.class, () -> interpreter.commit(first));
        }
    }
}
