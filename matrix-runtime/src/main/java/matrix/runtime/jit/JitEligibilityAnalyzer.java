package matrix.runtime.jit;

import com.matrixlang.compiler.ast.decl.Parameter;
import com.matrixlang.compiler.ast.expr.*;

import java.util.HashSet;
import java.util.Set;

/**
 * 判断 let 绑定的 lambda 是否只用到可编译的操作：
 * Int/Float/Bool 字面量、参数引用、算术、比较、逻辑运算、带 else 的 if，以及参数个数一致的直接自递归调用。
 */
public final class JitEligibilityAnalyzer {

    private JitEligibilityAnalyzer() {}

    public static JitDecision analyze(String name, LambdaExpr lambda) {
        Set<String> params = new HashSet<String>();
        for (Parameter p : lambda.getParams()) {
            params.add(p.getName());
        }
        // 参数遮蔽了函数名时，体内的同名调用不是自递归
        String self = name != null && !params.contains(name) ? name : null;
        String reason = scan(lambda.getBody(), params, self, lambda.getArity());
        return reason == null ? JitDecision.eligible() : JitDecision.rejected(reason);
    }

    /** 返回第一个不支持的构造，全部支持时返回 null */
    private static String scan(Expression expr, Set<String> params, String self, int arity) {
        if (expr instanceof Literal) {
            Literal.LiteralKind kind = ((Literal) expr).getKind();
            if (kind == Literal.LiteralKind.STRING || kind == Literal.LiteralKind.UNIT) {
                return kind.name().toLowerCase() + " literal";
            }
            return null;
        }
        if (expr instanceof Identifier) {
            String id = ((Identifier) expr).getName();
            return params.contains(id) ? null : "free variable '" + id + "'";
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) expr;
            String left = scan(bin.getLeft(), params, self, arity);
            return left != null ? left : scan(bin.getRight(), params, self, arity);
        }
        if (expr instanceof UnaryExpr) {
            return scan(((UnaryExpr) expr).getOperand(), params, self, arity);
        }
        if (expr instanceof IfExpr) {
            IfExpr ifExpr = (IfExpr) expr;
            if (!ifExpr.hasElse()) return "if without else";
            String reason = scan(ifExpr.getCondition(), params, self, arity);
            if (reason == null) reason = scan(ifExpr.getThenBranch(), params, self, arity);
            if (reason == null) reason = scan(ifExpr.getElseBranch(), params, self, arity);
            return reason;
        }
        if (expr instanceof BlockExpr) {
            BlockExpr block = (BlockExpr) expr;
            if (!block.getStatements().isEmpty() || block.getTrailing() == null) return "block with statements";
            return scan(block.getTrailing(), params, self, arity);
        }
        if (expr instanceof CallExpr) {
            CallExpr call = (CallExpr) expr;
            if (!(call.getCallee() instanceof Identifier) || self == null
                    || !self.equals(((Identifier) call.getCallee()).getName())) {
                return "call to a function other than itself";
            }
            if (call.getArguments().size() != arity) return "self call with wrong arity";
            for (Expression arg : call.getArguments()) {
                String reason = scan(arg, params, self, arity);
                if (reason != null) return reason;
            }
            return null;
        }
        return expr.getClass().getSimpleName();
    }
}
