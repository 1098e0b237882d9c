package matrix.runtime;

import com.matrixlang.compiler.diagnostic.ErrorKind;

/**
 * 运行时错误种类
 */
public enum RuntimeErrorKind implements ErrorKind {
    DivisionByZero,
    UndefinedVariable,
    ArgumentMismatch,
    IndexOutOfBounds,
    ImmutableAssignment,
    MatchFailure,
    CallDepthExceeded;

    @Override
    public String category() {
        return "RuntimeError";
    }
}
