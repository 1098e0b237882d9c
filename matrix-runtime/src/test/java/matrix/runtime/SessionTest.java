package matrix.runtime;

import com.matrixlang.compiler.analysis.TypeCheckException;
import com.matrixlang.compiler.analysis.TypeErrorKind;
import com.matrixlang.compiler.diagnostic.MatrixLangException;
import com.matrixlang.compiler.parser.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Session 端到端测试：检查、求值、REPL 提交与回滚
 */
class SessionTest {

    private ByteArrayOutputStream output;
    private Session session;

    @BeforeEach
    void setUp() {
        output = new ByteArrayOutputStream();
        session = new Session(SessionConfig.builder()
                .replMode(true)
                .out(new PrintStream(output, true, StandardCharsets.UTF_8))
                .build());
    }

    private MxValue eval(String source) {
        return session.evalRepl(source).getValue();
    }

    private String printed() {
        return new String(output.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Nested
    @DisplayName("程序求值")
    class RunTests {

        @Test
        @DisplayName("let 语句的值就是绑定的值")
        void testLetValue() {
            ReplResult result = session.evalRepl("let x = 5 + 3");
            assertEquals(8, result.getValue().asInt());
            assertEquals("Int", result.getType());
            assertEquals("Int", result.getBindingTypes().get("x"));
        }

        @Test
        @DisplayName("多条语句取最后一条的值")
        void testLastStatement() {
            MxValue v = eval("let add = (a, b) => a + b; let total = add(5, 10) + add(10, 10)\ntotal");
            assertEquals(35, v.asInt());
        }

        @Test
        @DisplayName("内置函数调用")
        void testBuiltins() {
            assertEquals(4.0, eval("sqrt(16.0)").asFloat());
            assertEquals(15, eval("abs(-15)").asInt());
            assertEquals(2.5, eval("abs(-2.5)").asFloat());
        }

        @Test
        @DisplayName("递归函数")
        void testRecursion() {
            assertEquals(120, eval("fn fact(n) = if n <= 1 then 1 else n * fact(n - 1)\nfact(5)").asInt());
            assertEquals(55, eval("fib(n) = if n < 2 then n else fib(n - 1) + fib(n - 2)\nfib(10)").asInt());
        }

        @Test
        @DisplayName("println 按顺序输出")
        void testPrintln() {
            MxValue v = eval("println(\"hello\")\nprintln(1 + 2)");
            assertTrue(v.isUnit());
            assertEquals("hello\n3\n", printed());
        }

        @Test
        @DisplayName("非 ASCII 字符串原样输出")
        void testUnicodeOutput() {
            eval("println(\"矩阵 ψ\")");
            assertEquals("矩阵 ψ\n", printed());
        }

        @Test
        @DisplayName("多态函数在不同类型上使用")
        void testPolymorphism() {
            eval("let id = (x) => x");
            assertEquals(3, eval("id(3)").asInt());
            assertEquals("s", eval("id(\"s\")").asString());
            assertEquals("(a) -> a", session.typeOf("id"));
        }

        @Test
        @DisplayName("非 REPL 模式下每次 run 都从空白会话开始")
        void testRunIsolated() {
            Session scripts = new Session();
            assertEquals(1, scripts.run("let a = 1\na", "a.mx").asInt());
            TypeCheckException e = assertThrows(TypeCheckException.class, () -> scripts.run("a", "b.mx"));
            assertEquals(TypeErrorKind.UnknownIdentifier, e.getKind());
        }

        @Test
        @DisplayName("check 不提交绑定")
        void testCheckOnly() {
            assertEquals("Int", session.check("let k = 1", "k.mx").getBindingTypes().get("k"));
            assertThrows(TypeCheckException.class, () -> eval("k"));
        }
    }

    @Nested
    @DisplayName("静态错误")
    class StaticErrorTests {

        @Test
        @DisplayName("未知标识符在求值前报告")
        void testUnknownIdentifier() {
            TypeCheckException e = assertThrows(TypeCheckException.class, () -> eval("println(\"x\")\nfoo"));
            assertEquals(TypeErrorKind.UnknownIdentifier, e.getKind());
            assertEquals("TypeError", e.getCategory());
            assertEquals(2, e.getLine());
            // 类型检查失败时第一条语句也没有执行
            assertEquals("", printed());
        }

        @Test
        @DisplayName("语法错误")
        void testParseError() {
            MatrixLangException e = assertThrows(ParseException.class, () -> eval("let = 1"));
            assertEquals("ParseError", e.getCategory());
        }

        @Test
        @DisplayName("不可变绑定不能赋值")
        void testImmutableAssignment() {
            eval("let fixed = 1");
            TypeCheckException e = assertThrows(TypeCheckException.class, () -> eval("fixed = 2"));
            assertEquals(TypeErrorKind.ImmutableAssignment, e.getKind());
        }
    }

    @Nested
    @DisplayName("REPL 提交与回滚")
    class ReplTests {

        @Test
        @DisplayName("绑定在输入之间保持")
        void testPersistence() {
            eval("let x = 5");
            eval("let y = x * 2");
            assertEquals(15, eval("x + y").asInt());
        }

        @Test
        @DisplayName("运行时错误的输入整体回滚")
        void testRuntimeFailureRollsBack() {
            eval("let mut counter = 1");
            MxRuntimeException e = assertThrows(MxRuntimeException.class,
                    () -> eval("let leaked = 2\ncounter = 10\n1 / 0"));
            assertEquals(RuntimeErrorKind.DivisionByZero, e.getKind());
            assertEquals(3, e.getLine());

            assertEquals(1, eval("counter").asInt());
            TypeCheckException unknown = assertThrows(TypeCheckException.class, () -> eval("leaked"));
            assertEquals(TypeErrorKind.UnknownIdentifier, unknown.getKind());
        }

        @Test
        @DisplayName("类型错误的输入不影响之前的绑定")
        void testStaticFailureRollsBack() {
            eval("let b = 2");
            assertThrows(TypeCheckException.class, () -> eval("let c = b + \"x\""));
            assertEquals(2, eval("b").asInt());
            assertThrows(TypeCheckException.class, () -> eval("c"));
        }

        @Test
        @DisplayName("遮蔽不影响已创建的闭包")
        void testShadowing() {
            eval("let base = 1");
            eval("let get = () => base");
            eval("let base = 100");
            assertEquals(1, eval("get()").asInt());
            assertEquals(100, eval("base").asInt());
        }

        @Test
        @DisplayName("闭包看到可变绑定的最新值")
        void testMutableCapture() {
            assertEquals(5, eval("let mut n = 1\nlet get = () => n\nn = 5\nget()").asInt());
        }

        @Test
        @DisplayName("reset 清除用户绑定")
        void testReset() {
            eval("let gone = 1");
            session.reset();
            assertThrows(TypeCheckException.class, () -> eval("gone"));
            assertEquals(1.0, eval("sqrt(1.0)").asFloat());
        }

        @Test
        @DisplayName("describeBindings 列出值与类型")
        void testDescribeBindings() {
            eval("let n = 3\nlet s = \"hi\"");
            assertThat(session.describeBindings())
                    .containsEntry("n", "3 : Int")
                    .containsEntry("s", "\"hi\" : String");
        }
    }

    @Nested
    @DisplayName("会话隔离")
    class IsolationTests {

        @Test
        @DisplayName("两个会话互不可见")
        void testIndependentSessions() {
            Session other = new Session(SessionConfig.builder().replMode(true).build());
            eval("let only_here = 1");
            assertThrows(TypeCheckException.class, () -> other.evalRepl("only_here"));
            assertEquals(2, other.evalRepl("let only_here = 2\nonly_here").getValue().asInt());
            assertEquals(1, eval("only_here").asInt());
        }
    }
}
