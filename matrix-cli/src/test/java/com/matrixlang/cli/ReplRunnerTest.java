package com.matrixlang.cli;

import matrix.runtime.SessionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * REPL 测试：续行判断、命令与逐条提交
 */
class ReplRunnerTest {

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private ReplRunner repl;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        repl = new ReplRunner(SessionConfig.defaults(),
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private void feed(String input) {
        repl.runFallbackLoop(new BufferedReader(new StringReader(input)));
    }

    private String out() {
        return new String(outBytes.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String err() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Nested
    @DisplayName("未闭合括号")
    class BracketTests {

        @Test
        void testBalanced() {
            assertFalse(ReplRunner.hasUnclosedBrackets("f(1, [2, 3])"));
            assertFalse(ReplRunner.hasUnclosedBrackets(""));
        }

        @Test
        void testUnclosed() {
            assertTrue(ReplRunner.hasUnclosedBrackets("let m = [[1.0, 2.0],"));
            assertTrue(ReplRunner.hasUnclosedBrackets("struct P {"));
            assertTrue(ReplRunner.hasUnclosedBrackets("f("));
        }

        @Test
        @DisplayName("字符串与注释中的括号不计数")
        void testIgnoresStringsAndComments() {
            assertFalse(ReplRunner.hasUnclosedBrackets("println(\"(\")"));
            assertFalse(ReplRunner.hasUnclosedBrackets("println(\"\\\"[\")"));
            assertFalse(ReplRunner.hasUnclosedBrackets("1 -- note ("));
        }
    }

    @Nested
    @DisplayName("求值与回显")
    class EvalTests {

        @Test
        @DisplayName("回显值与类型，绑定跨输入保持")
        void testEcho() {
            feed("let x = 5\nx * 2\n:quit\n");
            assertThat(out()).contains("5 : Int").contains("10 : Int");
        }

        @Test
        @DisplayName("未闭合括号时续行")
        void testContinuation() {
            feed("let v = [1,\n2, 3]\nv\n");
            assertThat(out()).contains("... ").contains("[1, 2, 3]");
            assertEquals("", err());
        }

        @Test
        @DisplayName("反斜杠续行")
        void testBackslashContinuation() {
            feed("let total = 1 + \\\n2\ntotal\n");
            assertThat(out()).contains("3 : Int");
        }

        @Test
        @DisplayName("出错的输入不留下绑定")
        void testErrorRollsBack() {
            feed("let a = 1\nlet b = 1 / 0\nb\na\n");
            assertThat(err()).contains("DivisionByZero").contains("UnknownIdentifier");
            assertThat(out()).contains("1 : Int");
        }

        @Test
        @DisplayName(":quit 之后的输入不再求值")
        void testQuit() {
            feed(":quit\nprintln(\"after\")\n");
            assertThat(out()).doesNotContain("after");
        }
    }

    @Nested
    @DisplayName("REPL 命令")
    class CommandTests {

        @Test
        void testType() {
            assertTrue(repl.handleReplCommand(":type (x) => x"));
            assertThat(out()).contains("(x) => x : (a) -> a");
        }

        @Test
        void testTypeError() {
            assertTrue(repl.handleReplCommand(":type 1 + \"s\""));
            assertThat(err()).contains("TypeError");
        }

        @Test
        void testEnvAndReset() {
            repl.evaluateAndPrint("let n = 3");
            assertTrue(repl.handleReplCommand(":env"));
            assertThat(out()).contains("n = 3 : Int");

            assertTrue(repl.handleReplCommand(":reset"));
            assertTrue(repl.getSession().describeBindings().isEmpty());
        }

        @Test
        void testQuitAliases() {
            assertFalse(repl.handleReplCommand(":q"));
            assertFalse(repl.handleReplCommand(":exit"));
        }

        @Test
        @DisplayName("帮助与未知命令的中文提示")
        void testHelpText() {
            assertTrue(repl.handleReplCommand(":help"));
            assertThat(out()).contains("显示表达式的类型").contains(":reset");
        }

        @Test
        void testUnknownCommand() {
            assertTrue(repl.handleReplCommand(":bogus"));
            assertThat(out()).contains("未知命令");
        }
    }
}
