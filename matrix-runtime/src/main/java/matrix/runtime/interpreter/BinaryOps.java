package matrix.runtime.interpreter;

import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import matrix.runtime.*;

/**
 * 二元与一元运算
 *
 * <p>Int 与 Float 混合时提升为 Float；矩阵的 + - 逐元素，* 为矩阵乘法；
 * 整数除法向零截断，除数为零报 DivisionByZero。</p>
 */
public final class BinaryOps {

    private BinaryOps() {}

    /**
     * 计算除 && || 之外的二元运算（短路运算由求值器处理）
     */
    public static MxValue apply(BinaryOp op, MxValue left, MxValue right, SourceLocation location) {
        switch (op) {
            case ADD:
                if (left.isString() && right.isString()) {
                    return MxString.of(left.asString() + right.asString());
                }
                return arithmetic(op, left, right, location);
            case SUB:
            case MUL:
            case DIV:
            case MOD:
            case POW:
                return arithmetic(op, left, right, location);
            case EQ:
                return MxBool.of(valueEquals(left, right));
            case NE:
                return MxBool.of(!valueEquals(left, right));
            case LT:
                return MxBool.of(compare(op, left, right, location) < 0);
            case GT:
                return MxBool.of(compare(op, left, right, location) > 0);
            case LE:
                return MxBool.of(compare(op, left, right, location) <= 0);
            case GE:
                return MxBool.of(compare(op, left, right, location) >= 0);
            case AND:
                return MxBool.of(left.asBool() && right.asBool());
            case OR:
                return MxBool.of(left.asBool() || right.asBool());
            default:
                throw new IllegalStateException("unknown operator " + op);
        }
    }

    private static MxValue arithmetic(BinaryOp op, MxValue left, MxValue right, SourceLocation location) {
        if (left.isInt() && right.isInt()) {
            return intArithmetic(op, left.asInt(), right.asInt(), location);
        }
        if (left.isNumber() && right.isNumber()) {
            return floatArithmetic(op, left.asNumber(), right.asNumber(), location);
        }
        if (left.isMatrix() && right.isMatrix()) {
            return matrixArithmetic(op, left.asMatrix(), right.asMatrix(), location);
        }
        throw operandMismatch(op, left, right, location);
    }

    public static MxValue intArithmetic(BinaryOp op, long a, long b, SourceLocation location) {
        switch (op) {
            case ADD: return MxInt.of(a + b);
            case SUB: return MxInt.of(a - b);
            case MUL: return MxInt.of(a * b);
            case DIV:
                if (b == 0) throw MxRuntimeException.divisionByZero(op.toSourceString(), location);
                return MxInt.of(a / b);
            case MOD:
                if (b == 0) throw MxRuntimeException.divisionByZero(op.toSourceString(), location);
                return MxInt.of(a % b);
            case POW:
                return MxInt.of(intPow(a, b));
            default:
                throw new IllegalStateException("not arithmetic: " + op);
        }
    }

    public static MxValue floatArithmetic(BinaryOp op, double a, double b, SourceLocation location) {
        switch (op) {
            case ADD: return MxFloat.of(a + b);
            case SUB: return MxFloat.of(a - b);
            case MUL: return MxFloat.of(a * b);
            case DIV:
                if (b == 0.0) throw MxRuntimeException.divisionByZero(op.toSourceString(), location);
                return MxFloat.of(a / b);
            case MOD:
                if (b == 0.0) throw MxRuntimeException.divisionByZero(op.toSourceString(), location);
                return MxFloat.of(a % b);
            case POW:
                return MxFloat.of(Math.pow(a, b));
            default:
                throw new IllegalStateException("not arithmetic: " + op);
        }
    }

    /** 负指数按浮点幂截断 */
    static long intPow(long base, long exp) {
        if (exp < 0) return (long) Math.pow(base, exp);
        long result = 1;
        long b = base;
        long e = exp;
        while (e > 0) {
            if ((e & 1) == 1) result *= b;
            b *= b;
            e >>= 1;
        }
        return result;
    }

    private static MxValue matrixArithmetic(BinaryOp op, MxMatrix a, MxMatrix b, SourceLocation location) {
        switch (op) {
            case ADD:
            case SUB:
                if (a.getRows() != b.getRows() || a.getCols() != b.getCols()) {
                    throw shapeMismatch(op, a.getRows() + "x" + a.getCols(), b, location);
                }
                MxValue[] cells = new MxValue[a.getRows() * a.getCols()];
                for (int r = 0; r < a.getRows(); r++) {
                    for (int c = 0; c < a.getCols(); c++) {
                        cells[r * a.getCols() + c] = arithmetic(op, a.get(r, c), b.get(r, c), location);
                    }
                }
                return new MxMatrix(a.getRows(), a.getCols(), cells);
            case MUL:
                return matrixProduct(a, b, location);
            default:
                throw operandMismatch(op, a, b, location);
        }
    }

    static MxMatrix matrixProduct(MxMatrix a, MxMatrix b, SourceLocation location) {
        if (a.getCols() != b.getRows()) {
            throw shapeMismatch(BinaryOp.MUL, a.getCols() + "xN", b, location);
        }
        MxValue[] cells = new MxValue[a.getRows() * b.getCols()];
        for (int r = 0; r < a.getRows(); r++) {
            for (int c = 0; c < b.getCols(); c++) {
                MxValue sum = arithmetic(BinaryOp.MUL, a.get(r, 0), b.get(0, c), location);
                for (int k = 1; k < a.getCols(); k++) {
                    sum = arithmetic(BinaryOp.ADD, sum,
                            arithmetic(BinaryOp.MUL, a.get(r, k), b.get(k, c), location), location);
                }
                cells[r * b.getCols() + c] = sum;
            }
        }
        return new MxMatrix(a.getRows(), b.getCols(), cells);
    }

    private static int compare(BinaryOp op, MxValue left, MxValue right, SourceLocation location) {
        if (left.isInt() && right.isInt()) return Long.compare(left.asInt(), right.asInt());
        if (left.isNumber() && right.isNumber()) return Double.compare(left.asNumber(), right.asNumber());
        if (left.isString() && right.isString()) return left.asString().compareTo(right.asString());
        throw operandMismatch(op, left, right, location);
    }

    /**
     * 结构相等；Int 与 Float 比较数值，Float 之间按容差比较
     */
    public static boolean valueEquals(MxValue left, MxValue right) {
        if (left.isNumber() && right.isNumber() && (left.isFloat() || right.isFloat())) {
            return Math.abs(left.asNumber() - right.asNumber()) < MxFloat.EPSILON;
        }
        return left.equals(right);
    }

    /**
     * 一元负号
     */
    public static MxValue negate(MxValue operand, SourceLocation location) {
        if (operand.isInt()) return MxInt.of(-operand.asInt());
        if (operand.isFloat()) return MxFloat.of(-operand.asFloat());
        if (operand.isMatrix()) {
            MxMatrix m = operand.asMatrix();
            MxValue[] cells = new MxValue[m.getRows() * m.getCols()];
            for (int r = 0; r < m.getRows(); r++) {
                for (int c = 0; c < m.getCols(); c++) {
                    cells[r * m.getCols() + c] = negate(m.get(r, c), location);
                }
            }
            return new MxMatrix(m.getRows(), m.getCols(), cells);
        }
        throw MxRuntimeException.argumentMismatch("-", "a number or matrix", operand.getTypeName(), location);
    }

    private static MxRuntimeException operandMismatch(BinaryOp op, MxValue left, MxValue right,
                                                      SourceLocation location) {
        return MxRuntimeException.argumentMismatch(op.toSourceString(), "compatible operands",
                left.getTypeName() + " and " + right.getTypeName(), location);
    }

    private static MxRuntimeException shapeMismatch(BinaryOp op, String expected, MxMatrix found,
                                                    SourceLocation location) {
        return MxRuntimeException.argumentMismatch(op.toSourceString(), "a " + expected + " matrix",
                "a " + found.getRows() + "x" + found.getCols() + " matrix", location);
    }
}
