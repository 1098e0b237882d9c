package com.matrixlang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

/**
 * matrix check 子命令：类型检查但不执行，打印顶层绑定的类型
 */
@Command(name = "check", mixinStandardHelpOptions = true,
         description = "类型检查脚本并打印顶层绑定的类型")
public class CheckCommand implements Callable<Integer> {

    @ParentCommand
    Main parent;

    @Option(names = "--json", description = "以 JSON 输出")
    boolean json;

    @Parameters(index = "0", paramLabel = "FILE", description = "脚本文件")
    String file;

    @Override
    public Integer call() {
        CliLogging.configure(parent.verbose);
        return new ScriptRunner(parent.sessionConfig(false), parent.getOut(), parent.getErr())
                .checkFile(file, json);
    }
}
