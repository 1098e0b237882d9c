package matrix.runtime.jit;

import com.matrixlang.compiler.ast.expr.LambdaExpr;
import com.matrixlang.compiler.ast.stmt.LetStmt;
import com.matrixlang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * JitEligibilityAnalyzer 单元测试
 */
class JitEligibilityAnalyzerTest {

    private static JitDecision analyze(String source) {
        LetStmt let = (LetStmt) new Parser(source, "<test>").parse().getStatements().get(0);
        return JitEligibilityAnalyzer.analyze(let.getName(), (LambdaExpr) let.getValue());
    }

    @Test
    @DisplayName("算术、比较、条件与自递归可编译")
    void testEligible() {
        assertTrue(analyze("fn fact(n) = if n <= 1 then 1 else n * fact(n - 1)").isEligible());
        assertTrue(analyze("let between = (x, lo, hi) => x >= lo && x <= hi && !(x == 0.5)").isEligible());
        assertTrue(analyze("let neg = (x) => { -x }").isEligible());
    }

    @Test
    @DisplayName("字符串字面量与调用其他函数不可编译")
    void testRejected() {
        JitDecision str = analyze("let greet = (n) => \"hi\"");
        assertFalse(str.isEligible());
        assertEquals("string literal", str.getReason());

        assertThat(analyze("let root = (x) => sqrt(x)").getReason()).contains("other than itself");
        assertThat(analyze("let g = (x) => y + x").getReason()).contains("free variable 'y'");
    }

    @Test
    @DisplayName("结构不在可编译集合中")
    void testUnsupportedConstructs() {
        assertFalse(analyze("let h = (x) => { let y = x\n y }").isEligible());
        assertFalse(analyze("let k = (x) => if x > 0 then 1").isEligible());
        assertFalse(analyze("let arr = (x) => [x, x]").isEligible());
    }

    @Test
    @DisplayName("自调用必须参数个数一致且名字未被参数遮蔽")
    void testSelfCalls() {
        assertThat(analyze("fn bad(n) = bad(n, 1)").getReason()).contains("wrong arity");
        assertFalse(analyze("fn f(f) = f(1)").isEligible());
    }
}
