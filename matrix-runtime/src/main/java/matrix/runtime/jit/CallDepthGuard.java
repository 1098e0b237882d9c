package matrix.runtime.jit;

import com.matrixlang.compiler.ast.SourceLocation;

/**
 * 调用深度计数。解释执行与编译后的函数共用同一个计数。
 */
public interface CallDepthGuard {

    /**
     * 进入一次函数调用
     *
     * @throws matrix.runtime.MxRuntimeException 超出最大深度（CallDepthExceeded）
     */
    void enter(String function, SourceLocation location);

    void exit();
}
