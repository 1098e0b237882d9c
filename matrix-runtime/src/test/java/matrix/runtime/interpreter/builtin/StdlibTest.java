package matrix.runtime.interpreter.builtin;

import matrix.runtime.*;
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
 * 标准库函数测试（经由完整会话调用）
 */
class StdlibTest {

    private static final double DELTA = 1e-9;

    private ByteArrayOutputStream output;
    private Session session;

    @BeforeEach
    void setUp() {
        output = new ByteArrayOutputStream();
        session = new Session(SessionConfig.builder()
                .replMode(true)
                .randomSeed(7L)
                .out(new PrintStream(output, true, StandardCharsets.UTF_8))
                .build());
    }

    private MxValue eval(String source) {
        return session.evalRepl(source).getValue();
    }

    private double[] floats(String source) {
        return eval(source).asArray().toDoubles();
    }

    private MxRuntimeException runtimeError(String source) {
        return assertThrows(MxRuntimeException.class, () -> eval(source));
    }

    @Nested
    @DisplayName("输入输出")
    class IoTests {

        @Test
        @DisplayName("print 不换行，字符串原样输出")
        void testPrint() {
            eval("print(\"a\")\nprint(1)\nprintln([1, 2])");
            String text = new String(output.toByteArray(), StandardCharsets.UTF_8);
            assertEquals("a1[1, 2]" + System.lineSeparator(), text);
        }

        @Test
        @DisplayName("to_string 与 type_of")
        void testConversions() {
            assertEquals("3.5", eval("to_string(3.5)").asString());
            assertEquals("Float", eval("type_of(1.0)").asString());
            assertEquals("Matrix", eval("type_of([[1, 2]])").asString());
        }
    }

    @Nested
    @DisplayName("数学")
    class MathTests {

        @Test
        @DisplayName("常量")
        void testConstants() {
            assertEquals(Math.PI, eval("pi").asFloat(), DELTA);
            assertEquals(2 * Math.PI, eval("tau").asFloat(), DELTA);
        }

        @Test
        @DisplayName("min / max / clamp 保持数值类型")
        void testMinMax() {
            assertEquals(2, eval("min(2, 5)").asInt());
            assertEquals(5.5, eval("max(2.0, 5.5)").asFloat(), DELTA);
            assertEquals(10, eval("clamp(42, 0, 10)").asInt());
        }

        @Test
        @DisplayName("Float 函数")
        void testFloatFunctions() {
            assertEquals(2.0, eval("cbrt(8.0)").asFloat(), DELTA);
            assertEquals(3.0, eval("floor(3.7)").asFloat(), DELTA);
            assertEquals(1.0, eval("sin(pi / 2.0)").asFloat(), DELTA);
            assertEquals(5.0, eval("lerp(0.0, 10.0, 0.5)").asFloat(), DELTA);
            assertEquals(3, eval("to_int(3.9)").asInt());
            assertEquals(2.0, eval("to_float(2)").asFloat(), DELTA);
        }

        @Test
        @DisplayName("固定种子的随机数可重复")
        void testRandom() {
            Session other = new Session(SessionConfig.builder().replMode(true).randomSeed(7L).build());
            double first = eval("random()").asFloat();
            assertEquals(first, other.evalRepl("random()").getValue().asFloat(), 0.0);
            double ranged = eval("random_range(5.0, 6.0)").asFloat();
            assertThat(ranged).isBetween(5.0, 6.0);
        }
    }

    @Nested
    @DisplayName("向量")
    class VectorTests {

        @Test
        @DisplayName("点积、叉积与长度")
        void testProducts() {
            assertEquals(32.0, eval("dot([1.0, 2.0, 3.0], [4.0, 5.0, 6.0])").asFloat(), DELTA);
            assertArrayEquals(new double[]{0.0, 0.0, 1.0},
                    floats("cross(vec3(1.0, 0.0, 0.0), vec3(0.0, 1.0, 0.0))"), DELTA);
            assertEquals(5.0, eval("magnitude([3.0, 4.0])").asFloat(), DELTA);
            assertEquals(5.0, eval("distance([0.0, 0.0], [3.0, 4.0])").asFloat(), DELTA);
        }

        @Test
        @DisplayName("归一化零向量保持不变")
        void testNormalize() {
            assertArrayEquals(new double[]{0.6, 0.8}, floats("normalize([3.0, 4.0])"), DELTA);
            assertArrayEquals(new double[]{0.0, 0.0, 0.0}, floats("normalize([0.0, 0.0, 0.0])"), DELTA);
        }

        @Test
        @DisplayName("反射")
        void testReflect() {
            assertArrayEquals(new double[]{1.0, 1.0}, floats("reflect([1.0, -1.0], [0.0, 1.0])"), DELTA);
        }

        @Test
        @DisplayName("长度不一致报告 ArgumentMismatch")
        void testLengthMismatch() {
            assertEquals(RuntimeErrorKind.ArgumentMismatch, runtimeError("dot([1.0], [1.0, 2.0])").getKind());
        }
    }

    @Nested
    @DisplayName("数组")
    class ArrayTests {

        @Test
        @DisplayName("不可变数组操作返回新数组")
        void testImmutable() {
            eval("let xs = [3, 1, 2]");
            assertEquals("[3, 1, 2, 4]", eval("array_push(xs, 4)").toString());
            assertEquals("[3, 1]", eval("array_pop(xs)").toString());
            assertEquals("[1, 2, 3]", eval("array_sort(xs)").toString());
            assertEquals("[2, 1, 3]", eval("array_reverse(xs)").toString());
            assertEquals("[3, 1, 2]", eval("xs").toString());
            assertEquals(3, eval("len(xs)").asInt());
        }

        @Test
        @DisplayName("求和与平均")
        void testSumAvg() {
            assertEquals(6, eval("array_sum([1, 2, 3])").asInt());
            assertEquals(1.5, eval("array_sum([0.5, 1.0])").asFloat(), DELTA);
            assertEquals(2.0, eval("array_avg([1, 2, 3])").asFloat(), DELTA);
            assertEquals(0, eval("array_sum([])").asInt());
            assertEquals(RuntimeErrorKind.DivisionByZero, runtimeError("array_avg([])").getKind());
        }

        @Test
        @DisplayName("字符串排序")
        void testSortStrings() {
            assertEquals("[\"a\", \"b\", \"c\"]", eval("array_sort([\"c\", \"a\", \"b\"])").toString());
        }
    }

    @Nested
    @DisplayName("矩阵")
    class MatrixTests {

        @Test
        @DisplayName("转置与尺寸")
        void testTranspose() {
            eval("let m = [[1, 2, 3], [4, 5, 6]]");
            assertEquals(3, eval("matrix_rows(transpose(m))").asInt());
            assertEquals(2, eval("matrix_cols(transpose(m))").asInt());
            assertEquals("[[1, 4], [2, 5], [3, 6]]", eval("transpose(m)").toString());
        }

        @Test
        @DisplayName("行列式与单位矩阵")
        void testDeterminant() {
            assertEquals(-2.0, eval("determinant([[1, 2], [3, 4]])").asFloat(), DELTA);
            assertEquals(1.0, eval("determinant(identity(3))").asFloat(), DELTA);
            assertEquals(RuntimeErrorKind.ArgumentMismatch, runtimeError("determinant([[1, 2, 3]])").getKind());
        }

        @Test
        @DisplayName("嵌套数组转为矩阵")
        void testToMatrix() {
            MxValue m = eval("to_matrix(map([1.0, 3.0], x => [x, x + 1.0]))");
            assertTrue(m.isMatrix());
            assertEquals(4.0, m.asMatrix().get(1, 1).asFloat(), DELTA);
            assertEquals(RuntimeErrorKind.ArgumentMismatch, runtimeError("to_matrix([[1], [2, 3]])").getKind());
        }
    }

    @Nested
    @DisplayName("外部协作者")
    class CollaboratorTests {

        @Test
        @DisplayName("物理世界通过句柄操作")
        void testPhysics() {
            eval("let world = create_physics_world()\n"
                    + "let ball = add_rigid_body(world, 1.0, [0.0, 10.0, 0.0])\n"
                    + "set_velocity(world, ball, [1.0, 0.0, 0.0])\n"
                    + "physics_step(world, 1.0)");
            double[] pos = floats("get_position(world, ball)");
            assertEquals(1.0, pos[0], DELTA);
            assertEquals(10.0 - 9.81, pos[1], DELTA);
            assertEquals(1, eval("body_count(world)").asInt());
            assertEquals("PhysicsWorld", eval("world").getTypeName());
        }

        @Test
        @DisplayName("物理纯函数")
        void testPhysicsHelpers() {
            assertEquals(9.0, eval("kinetic_energy(2.0, [3.0, 0.0, 0.0])").asFloat(), DELTA);
            assertArrayEquals(new double[]{2.0, 4.0, 6.0}, floats("momentum(2.0, [1.0, 2.0, 3.0])"), DELTA);
            assertEquals(RuntimeErrorKind.DivisionByZero,
                    runtimeError("gravitational_force(1.0, 1.0, 0.0)").getKind());
        }

        @Test
        @DisplayName("无效刚体编号报告 IndexOutOfBounds")
        void testMissingBody() {
            eval("let w = create_physics_world()");
            assertEquals(RuntimeErrorKind.IndexOutOfBounds, runtimeError("get_position(w, 3)").getKind());
        }

        @Test
        @DisplayName("量子线路：Bell 态")
        void testQuantum() {
            eval("let q = quantum_circuit(2)\nhadamard(q, 0)\ncnot(q, 0, 1)");
            assertArrayEquals(new double[]{0.5, 0.0, 0.0, 0.5}, floats("probabilities(q)"), DELTA);
            long outcome = eval("measure(q, 11)").asInt();
            assertTrue(outcome == 0 || outcome == 3);
            assertEquals(RuntimeErrorKind.IndexOutOfBounds, runtimeError("pauli_x(q, 5)").getKind());
        }
    }
}
