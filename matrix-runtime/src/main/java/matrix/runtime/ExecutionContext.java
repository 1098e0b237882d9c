package matrix.runtime;

import matrix.runtime.collab.HandleTable;

import java.io.PrintStream;
import java.util.List;
import java.util.Random;

/**
 * 内置函数可见的执行上下文（一个会话一个）
 */
public interface ExecutionContext {

    /** 调用一个函数值（map/filter/fold 等高阶内置函数使用） */
    MxValue invoke(MxValue callee, List<MxValue> args);

    /** print/println 的输出流 */
    PrintStream getOut();

    /** random/random_range 的随机源；配置了种子时可复现 */
    Random getRandom();

    /** 外部协作者对象的句柄表 */
    HandleTable getHandles();
}
