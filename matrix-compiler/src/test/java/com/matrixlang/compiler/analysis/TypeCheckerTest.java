package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.TypeScheme;
import com.matrixlang.compiler.ast.Program;
import com.matrixlang.compiler.ast.expr.MatrixLiteral;
import com.matrixlang.compiler.ast.stmt.ExpressionStmt;
import com.matrixlang.compiler.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TypeChecker 单元测试
 */
class TypeCheckerTest {

    private TypeChecker checker;

    /** 测试用的最小内置签名表 */
    private static SignatureTable signatures() {
        final Map<String, TypeScheme> table = new HashMap<String, TypeScheme>();
        table.put("println", SchemeParser.parse("(a) -> Unit"));
        table.put("sqrt", SchemeParser.parse("(Float) -> Float"));
        table.put("abs", SchemeParser.parse("Num a => (a) -> a"));
        table.put("map", SchemeParser.parse("([a], (a) -> b) -> [b]"));
        return new SignatureTable() {
            @Override
            public TypeScheme lookupSignature(String name) {
                return table.get(name);
            }

            @Override
            public Collection<String> signatureNames() {
                return table.keySet();
            }
        };
    }

    @BeforeEach
    void setUp() {
        checker = new TypeChecker(signatures());
    }

    private Program parse(String source) {
        return new Parser(source, "<test>").parse();
    }

    /** 检查并提交 */
    private CheckResult check(String source) {
        CheckResult result = checker.check(parse(source));
        checker.commit(result);
        return result;
    }

    private String typeOf(String source) {
        return check(source).getType().toDisplayString();
    }

    private TypeCheckException error(String source) {
        return assertThrows(TypeCheckException.class, () -> check(source));
    }

    @Nested
    @DisplayName("基本推断")
    class BasicTests {

        @Test
        @DisplayName("let 语句的类型为值的类型")
        void testLetValue() {
            assertEquals("Int", typeOf("let x = 5 + 3"));
            assertEquals("Float", typeOf("2.5 * 2.0"));
            assertEquals("String", typeOf("\"a\" + \"b\""));
            assertEquals("Bool", typeOf("1 < 2 && !false"));
            assertEquals("Unit", typeOf(""));
        }

        @Test
        @DisplayName("带注解的函数相加")
        void testAnnotatedFunctions() {
            String program = "let add = (a: Int, b: Int) => a + b\n"
                    + "let multiply = (a: Int, b: Int) => a * b\n"
                    + "let power_func = (a: Int, b: Int) => a ^ b\n"
                    + "add(5, 10) + multiply(3, 4) + power_func(2, 3)";
            CheckResult result = check(program);
            assertEquals("Int", result.getType().toDisplayString());
            assertEquals("(Int, Int) -> Int", result.getBindingTypes().get("add"));
        }

        @Test
        @DisplayName("内置函数签名")
        void testBuiltins() {
            assertEquals("Float", typeOf("sqrt(16.0)"));
            assertEquals("Int", typeOf("abs(-15)"));
            assertEquals("Float", typeOf("abs(-1.5)"));
            assertEquals("[String]", typeOf("map([1, 2], (x) => \"n\")"));
        }

        @Test
        @DisplayName("递归函数")
        void testRecursion() {
            CheckResult result = check("factorial(n) = if n <= 1 then 1 else n * factorial(n - 1)\nfactorial(5)");
            assertEquals("Int", result.getType().toDisplayString());
            assertEquals("(Int) -> Int", result.getBindingTypes().get("factorial"));
        }

        @Test
        @DisplayName("未加注解的算术函数保留 Num 约束")
        void testConstrainedGeneralization() {
            CheckResult result = check("let double = (x) => x * 2.0 / 2.0\nlet sq = (x) => x * x");
            assertEquals("(Float) -> Float", result.getBindingTypes().get("double"));
            assertEquals("Arith a => (a) -> a", result.getBindingTypes().get("sq"));
        }
    }

    @Nested
    @DisplayName("多态")
    class PolymorphismTests {

        @Test
        @DisplayName("let 多态：id 用于不同类型")
        void testLetPolymorphism() {
            CheckResult result = check("let id = (x) => x\nid(5)\nid(\"a\")");
            assertEquals("String", result.getType().toDisplayString());
            assertEquals("(a) -> a", result.getBindingTypes().get("id"));
        }

        @Test
        @DisplayName("同一作用域内两次调用泛型内置函数")
        void testBuiltinInstantiatedPerUse() {
            assertEquals("Unit", typeOf("{\n println(42)\n println(\"hello\")\n}"));
        }

        @Test
        @DisplayName("lambda 参数不被泛化")
        void testLambdaParamMonomorphic() {
            TypeCheckException e = error("let g = (f) => f(1) + f(\"a\")");
            assertEquals(TypeErrorKind.Mismatch, e.getKind());
        }

        @Test
        @DisplayName("let mut 绑定不被泛化")
        void testMutableNotGeneralized() {
            check("let mut xs = []");
            check("xs = [1]");
            assertEquals(TypeErrorKind.Mismatch, error("xs = [\"s\"]").getKind());
        }

        @Test
        @DisplayName("每个会话的类型变量计数独立")
        void testIndependentSessions() {
            TypeChecker other = new TypeChecker(signatures());
            check("let id = (x) => x\nid(1)");
            assertEquals(0, other.getUnifier().getVariableCount());
        }
    }

    @Nested
    @DisplayName("类型错误")
    class ErrorTests {

        @Test
        @DisplayName("未定义的标识符")
        void testUnknownIdentifier() {
            TypeCheckException e = error("let y = 1\nfoo + y");
            assertEquals(TypeErrorKind.UnknownIdentifier, e.getKind());
            assertEquals("foo", e.getSubject());
            assertEquals(2, e.getLine());
            assertEquals(1, e.getColumn());
            assertEquals("TypeError", e.getCategory());
        }

        @Test
        @DisplayName("出现检查")
        void testOccursCheck() {
            TypeCheckException e = error("let f = (x) => x(x)");
            assertEquals(TypeErrorKind.InfiniteType, e.getKind());
        }

        @Test
        @DisplayName("类型不匹配带期望与实际类型")
        void testMismatch() {
            TypeCheckException e = error("1 + \"a\"");
            assertEquals(TypeErrorKind.Mismatch, e.getKind());
            assertEquals("Int", e.getSubject());
            assertEquals("String", e.getFound());
            assertThat(e.getMessage()).startsWith("Mismatch: expected Int, found String at line 1");
        }

        @Test
        @DisplayName("运算符约束")
        void testOperatorConstraints() {
            assertEquals(TypeErrorKind.Mismatch, error("\"a\" - \"b\"").getKind());
            assertEquals(TypeErrorKind.Mismatch, error("true < false").getKind());
            assertEquals(TypeErrorKind.Mismatch, error("abs(\"x\")").getKind());
            assertEquals(TypeErrorKind.Mismatch, error("sqrt(16)").getKind());
            assertEquals(TypeErrorKind.Mismatch, error("if 1 then 2 else 3").getKind());
        }

        @Test
        @DisplayName("函数值不能比较相等")
        void testFunctionEquality() {
            TypeCheckException e = error("let f = (x) => x + 1\nf == f");
            assertEquals(TypeErrorKind.Mismatch, e.getKind());
            assertThat(e.getMessage()).contains("a comparable type");
            assertEquals(TypeErrorKind.Mismatch, error("let g = (x) => x * 2\ng != (y) => y").getKind());
            assertEquals("Bool", typeOf("let h = (x) => x - 1\nh(1) == 0"));
        }

        @Test
        @DisplayName("参数个数")
        void testArity() {
            TypeCheckException e = error("let add = (a, b) => a + b\nadd(1)");
            assertEquals(TypeErrorKind.ArityMismatch, e.getKind());
            assertEquals(TypeErrorKind.Mismatch, error("5(1)").getKind());
        }

        @Test
        @DisplayName("不可变绑定不能赋值")
        void testImmutableAssignment() {
            assertEquals(TypeErrorKind.ImmutableAssignment, error("let x = 1\nx = 2").getKind());
            assertEquals("Unit", typeOf("let mut y = 1\ny = 2"));
            assertEquals(TypeErrorKind.Mismatch, error("y = \"s\"").getKind());
        }

        @Test
        @DisplayName("没有 else 的 if 必须为 Unit")
        void testIfWithoutElse() {
            assertEquals("Unit", typeOf("if true then println(1)"));
            assertEquals(TypeErrorKind.Mismatch, error("if true then 1").getKind());
        }
    }

    @Nested
    @DisplayName("矩阵与数组")
    class MatrixTests {

        private Boolean decision(CheckResult result) {
            ExpressionStmt stmt = (ExpressionStmt) result.getProgram().getStatements().get(0);
            return result.getAnnotations().isMatrix((MatrixLiteral) stmt.getExpression());
        }

        @Test
        @DisplayName("数值元素为矩阵")
        void testNumericMatrix() {
            CheckResult result = check("[[1, 2], [3, 4]]");
            assertEquals("Matrix<Int>", result.getType().toDisplayString());
            assertEquals(Boolean.TRUE, decision(result));
            assertEquals("Matrix<Float>", typeOf("[[1.0, 2.0]] * [[1.0], [2.0]]"));
        }

        @Test
        @DisplayName("非数值元素为嵌套数组")
        void testNestedArray() {
            CheckResult result = check("[[\"a\"], [\"b\"]]");
            assertEquals("[[String]]", result.getType().toDisplayString());
            assertEquals(Boolean.FALSE, decision(result));
            assertEquals("[[Int]]", typeOf("[[1], [2, 3]]"));
        }

        @Test
        @DisplayName("元素类型未定时为嵌套数组")
        void testUnresolvedElements() {
            assertEquals("([[Int]]) -> Int",
                    check("let first = (m) => m[0][0] + 0\nlet pair = (a, b) => [[a, b], [b, a]]").getBindingTypes().get("first"));
            assertEquals("[[Int]]", typeOf("pair(1, 2)"));
        }

        @Test
        @DisplayName("元素类型必须一致")
        void testElementMismatch() {
            assertEquals(TypeErrorKind.Mismatch, error("[1, \"a\"]").getKind());
            assertEquals(TypeErrorKind.Mismatch, error("[[1, 2], [3.0, 4.0]]").getKind());
        }

        @Test
        @DisplayName("索引与推导式")
        void testIndexAndComprehension() {
            assertEquals("[Int]", typeOf("[[1, 2], [3, 4]][0]"));
            assertEquals("[Int]", typeOf("[x * 2 | x in 1..5, x > 2]"));
            assertEquals("[String]", typeOf("[s | n in [1, 2], s in [\"a\"]]"));
            assertEquals(TypeErrorKind.Mismatch, error("[x | x in 1..3, x]").getKind());
        }
    }

    @Nested
    @DisplayName("结构体与模式匹配")
    class StructTests {

        @BeforeEach
        void declare() {
            check("struct Point { x: Float, y: Float = 0.0 }");
        }

        @Test
        @DisplayName("字段默认值与字段访问")
        void testLiteral() {
            assertEquals("Float", typeOf("let p = Point { x: 1.0 }\np.y"));
            assertEquals("(Point) -> Float", check("let getx = (p) => p.x").getBindingTypes().get("getx"));
        }

        @Test
        @DisplayName("缺少字段与未知字段")
        void testFieldErrors() {
            assertEquals(TypeErrorKind.ArityMismatch, error("Point { y: 1.0 }").getKind());
            TypeCheckException unknown = error("Point { x: 1.0, z: 2.0 }");
            assertEquals(TypeErrorKind.UnknownIdentifier, unknown.getKind());
            assertEquals("Point.z", unknown.getSubject());
            assertEquals(TypeErrorKind.UnknownIdentifier, error("Line { a: 1 }").getKind());
        }

        @Test
        @DisplayName("match 分支：模式变量类型与守卫")
        void testMatch() {
            assertEquals("Float", typeOf("match Point { x: 1.0 } {\n"
                    + "  Point { x: 0.0, y } => y\n"
                    + "  Point { x } if x > 1.0 => x\n"
                    + "  _ => 0.0\n"
                    + "}"));
            assertEquals(TypeErrorKind.Mismatch, error("match 1 { n if n => 1, _ => 2 }").getKind());
            assertEquals(TypeErrorKind.Mismatch, error("match 1 { 0 => \"zero\", _ => 2 }").getKind());
            assertEquals("Int", typeOf("match [1, 2] { [a, b] => a + b, _ => 0 }"));
        }
    }

    @Nested
    @DisplayName("类型类、模块与并发语法")
    class DeclarationTests {

        @Test
        @DisplayName("类型类方法只接受有实例的类型")
        void testTypeclass() {
            check("typeclass Show<T> {\n  show: (T) -> String\n}\n"
                    + "instance Show<Int> {\n  show(x) = \"int\"\n}");
            assertEquals("String", typeOf("show(5)"));
            assertEquals(TypeErrorKind.Mismatch, error("show(1.5)").getKind());
            assertEquals("Show a => (a) -> String", check("let describe = (v) => show(v)").getBindingTypes().get("describe"));
            assertEquals("String", typeOf("describe(3)"));
        }

        @Test
        @DisplayName("实例缺少方法")
        void testIncompleteInstance() {
            check("typeclass Eq2<T> {\n  eq: (T, T) -> Bool\n  ne: (T, T) -> Bool\n}");
            TypeCheckException e = error("instance Eq2<Int> {\n  eq(a, b) = a == b\n}");
            assertEquals(TypeErrorKind.ArityMismatch, e.getKind());
        }

        @Test
        @DisplayName("模块成员与导入")
        void testModule() {
            check("module Geo {\n  let two = 2\n  area(r) = r * r * 3.0\n}");
            assertEquals("Int", typeOf("Geo.two + 1"));
            assertEquals(TypeErrorKind.UnknownIdentifier, error("Geo.three").getKind());
            assertEquals(TypeErrorKind.UnknownIdentifier, error("area(1.0)").getKind());
            check("import Geo.{area}");
            assertEquals("Float", typeOf("area(1.0)"));
            assertEquals("Unit", typeOf("import math"));
            assertEquals(TypeErrorKind.UnknownIdentifier, error("import Nowhere").getKind());
        }

        @Test
        @DisplayName("spawn 与 wait")
        void testTasks() {
            assertEquals("Task<Int>", typeOf("spawn 42"));
            assertEquals("Int", typeOf("wait spawn 42"));
            assertEquals("[String]", typeOf("wait [spawn \"a\", spawn \"b\"]"));
            assertEquals(TypeErrorKind.Mismatch, error("wait 5").getKind());
        }

        @Test
        @DisplayName("parallel 中的绑定在之后可见")
        void testParallel() {
            assertEquals("Int", typeOf("parallel {\n let a = 1\n let b = 2\n}\na + b"));
        }
    }

    @Nested
    @DisplayName("会话：提交与回滚")
    class SessionTests {

        @Test
        @DisplayName("未提交的结果不可见")
        void testUncommitted() {
            CheckResult pending = checker.check(parse("let a = 1"));
            checker.rollback(pending);
            assertEquals(TypeErrorKind.UnknownIdentifier, error("a").getKind());
        }

        @Test
        @DisplayName("失败的检查不影响之前的绑定")
        void testFailureIsRolledBack() {
            check("let b = 2");
            error("let c = b + \"x\"");
            assertEquals(TypeErrorKind.UnknownIdentifier, error("c").getKind());
            assertEquals("Int", typeOf("b"));
        }

        @Test
        @DisplayName("失败检查中的合一被撤销")
        void testSubstitutionRestored() {
            check("let mut m = []");
            error("m = [1]\nundefined_name");
            check("m = [\"s\"]");
            assertEquals("[String]", typeOf("m"));
        }

        @Test
        @DisplayName("表达式类型查询不改变会话")
        void testTypeOf() {
            check("let id = (x) => x");
            Parser parser = new Parser("id", "<test>");
            assertEquals("(a) -> a", checker.typeOf(parser.parseStandaloneExpression()).toDisplayString());
            Parser sqrt = new Parser("sqrt", "<test>");
            assertEquals("(Float) -> Float", checker.typeOf(sqrt.parseStandaloneExpression()).toDisplayString());
        }

        @Test
        @DisplayName("基于旧环境的结果不能提交")
        void testStaleCommit() {
            CheckResult first = checker.check(parse("let a = 1"));
            check("let b = 2");
            assertThrows(IllegalStateException.class, () -> checker.commit(first));
        }
    }
}
