package matrix.runtime;

import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.diagnostic.MatrixLangException;

/**
 * 运行时错误。中止当前顶层求值；REPL 中之前的绑定保持不变。
 */
public class MxRuntimeException extends MatrixLangException {

    private final String subject;

    public MxRuntimeException(RuntimeErrorKind kind, String message, SourceLocation location, String subject) {
        super(kind, message, location);
        this.subject = subject;
    }

    public static MxRuntimeException divisionByZero(String operator, SourceLocation location) {
        return new MxRuntimeException(RuntimeErrorKind.DivisionByZero,
                "division by zero in '" + operator + "'", location, operator);
    }

    public static MxRuntimeException undefinedVariable(String name, SourceLocation location) {
        return new MxRuntimeException(RuntimeErrorKind.UndefinedVariable,
                "undefined variable '" + name + "'", location, name);
    }

    /**
     * @param name     出错的函数名
     * @param expected 期望的参数描述
     * @param got      实际收到的参数描述
     */
    public static MxRuntimeException argumentMismatch(String name, String expected, String got,
                                                      SourceLocation location) {
        return new MxRuntimeException(RuntimeErrorKind.ArgumentMismatch,
                "'" + name + "' expected " + expected + ", got " + got, location, name);
    }

    public static MxRuntimeException indexOutOfBounds(long index, int size, SourceLocation location) {
        return new MxRuntimeException(RuntimeErrorKind.IndexOutOfBounds,
                "index " + index + " out of bounds for length " + size, location, String.valueOf(index));
    }

    /** 内置函数内部抛出的错误没有位置，由调用点补上 */
    public MxRuntimeException locatedAt(SourceLocation location) {
        if (getLine() > 0 || location == null) return this;
        MxRuntimeException located = new MxRuntimeException(getKind(), getRawMessage(), location, subject);
        located.setStackTrace(getStackTrace());
        return located;
    }

    @Override
    public RuntimeErrorKind getKind() {
        return (RuntimeErrorKind) super.getKind();
    }

    /** 出错的标识符或调用名 */
    public String getSubject() {
        return subject;
    }
}
