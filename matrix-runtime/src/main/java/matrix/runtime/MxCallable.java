package matrix.runtime;

import java.util.List;

/**
 * 可调用值：闭包、内置函数、类型类方法
 */
public interface MxCallable {

    String getName();

    /** 参数个数 */
    int getArity();

    MxValue call(ExecutionContext ctx, List<MxValue> args);
}
