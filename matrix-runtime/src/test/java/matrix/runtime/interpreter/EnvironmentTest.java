package matrix.runtime.interpreter;

import matrix.runtime.MxInt;
import matrix.runtime.MxRuntimeException;
import matrix.runtime.MxString;
import matrix.runtime.RuntimeErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Environment（作用域帧）单元测试
 */
class EnvironmentTest {

    private Environment env;

    @BeforeEach
    void setUp() {
        env = new Environment();
    }

    // ============ 基本定义和获取 ============

    @Nested
    @DisplayName("变量定义和获取")
    class DefineAndLookupTests {

        @Test
        @DisplayName("定义和获取")
        void testDefine() {
            env.define("x", MxInt.of(42), false);
            assertEquals(42, env.lookup("x").asInt());
        }

        @Test
        @DisplayName("未定义变量返回 null")
        void testLookupUndefined() {
            assertNull(env.lookup("undefined"));
        }

        @Test
        @DisplayName("同名绑定遮蔽之前的绑定")
        void testShadowing() {
            env.define("v", MxInt.of(1), false);
            env.define("v", MxString.of("s"), false);
            assertEquals("s", env.lookup("v").asString());
            assertThat(env.getLocalBindings()).hasSize(1).containsKey("v");
        }

        @Test
        @DisplayName("占位绑定在填入前不可见")
        void testPlaceholder() {
            int slot = env.definePlaceholder("f");
            assertNull(env.lookup("f"));
            env.fill(slot, MxInt.of(7));
            assertEquals(7, env.lookup("f").asInt());
        }
    }

    // ============ 变量赋值 ============

    @Nested
    @DisplayName("变量赋值")
    class AssignmentTests {

        @Test
        @DisplayName("可变绑定可以赋值，日志可撤销")
        void testAssignAndUndo() {
            env.define("count", MxInt.of(0), true);
            AssignmentJournal journal = new AssignmentJournal();
            env.assign("count", MxInt.of(10), journal, null);
            assertEquals(10, env.lookup("count").asInt());
            assertFalse(journal.isEmpty());

            journal.undo();
            assertEquals(0, env.lookup("count").asInt());
            assertTrue(journal.isEmpty());
        }

        @Test
        @DisplayName("不可变绑定赋值抛出 ImmutableAssignment")
        void testImmutable() {
            env.define("fixed", MxInt.of(1), false);
            MxRuntimeException e = assertThrows(MxRuntimeException.class,
                    () -> env.assign("fixed", MxInt.of(2), null, null));
            assertEquals(RuntimeErrorKind.ImmutableAssignment, e.getKind());
        }

        @Test
        @DisplayName("未定义变量赋值抛出 UndefinedVariable")
        void testUndefined() {
            MxRuntimeException e = assertThrows(MxRuntimeException.class,
                    () -> env.assign("missing", MxInt.of(2), null, null));
            assertEquals(RuntimeErrorKind.UndefinedVariable, e.getKind());
            assertEquals("missing", e.getSubject());
        }

        @Test
        @DisplayName("子帧对外层可变绑定的赋值对外层可见")
        void testAssignThroughChild() {
            env.define("n", MxInt.of(1), true);
            Environment inner = env.child();
            inner.assign("n", MxInt.of(5), null, null);
            assertEquals(5, env.lookup("n").asInt());
        }
    }

    // ============ 词法视图 ============

    @Nested
    @DisplayName("子帧的词法视图")
    class ChildTests {

        @Test
        @DisplayName("子帧只看到创建时已存在的父帧绑定")
        void testParentLimit() {
            env.define("a", MxInt.of(1), false);
            Environment captured = env.child();
            env.define("a", MxInt.of(2), false);
            env.define("b", MxInt.of(3), false);

            assertEquals(1, captured.lookup("a").asInt());
            assertNull(captured.lookup("b"));
            assertEquals(2, env.lookup("a").asInt());
        }

        @Test
        @DisplayName("可见绑定内层优先")
        void testVisibleBindings() {
            env.define("a", MxInt.of(1), false);
            env.define("b", MxInt.of(2), false);
            Environment inner = env.child();
            inner.define("a", MxInt.of(10), false);

            assertThat(inner.getVisibleBindings())
                    .containsEntry("a", MxInt.of(10))
                    .containsEntry("b", MxInt.of(2));
            assertThat(inner.getLocalBindings()).containsOnlyKeys("a");
        }
    }
}
