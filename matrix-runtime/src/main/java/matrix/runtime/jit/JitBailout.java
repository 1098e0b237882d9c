package matrix.runtime.jit;

/**
 * 编译后的函数遇到无法处理的值形状。调用方回退到解释执行，不向用户报告。
 */
public final class JitBailout extends RuntimeException {

    public JitBailout(String message) {
        super(message, null, false, false);
    }
}
