package com.matrixlang.cli;

import matrix.runtime.SessionConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;

/**
 * matrix-lang CLI 入口点（picocli）
 *
 * <p>无参数时进入 REPL；给出文件时执行脚本；-e 执行单个表达式。</p>
 */
@Command(name = "matrix", version = "matrix-lang v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {CheckCommand.class})
public class Main implements Callable<Integer> {

    @Option(names = "--jit", description = "启用纯数值闭包的 JIT 编译")
    boolean jit;

    @Option(names = "--max-depth", paramLabel = "N",
            description = "最大调用深度（默认 ${DEFAULT-VALUE}）")
    int maxDepth = SessionConfig.DEFAULT_MAX_CALL_DEPTH;

    @Option(names = "--seed", paramLabel = "SEED", description = "random 等内置函数的随机种子")
    Long seed;

    @Option(names = "-e", paramLabel = "EXPR", description = "执行表达式")
    String expression;

    @Option(names = "--parse-only", description = "只做词法、语法与类型检查，不执行")
    boolean parseOnly;

    @Option(names = "--json", description = "以 JSON 输出 --parse-only 的结果")
    boolean json;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志")
    boolean verbose;

    @Parameters(arity = "0..1", paramLabel = "FILE", description = "脚本文件")
    String file;

    private final PrintStream out;
    private final PrintStream err;

    public Main() {
        this(System.out, System.err);
    }

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        CliLogging.configure(verbose);
        ScriptRunner runner = new ScriptRunner(sessionConfig(false), out, err);
        if (expression != null) {
            return runner.runExpression(expression);
        }
        if (file != null) {
            return parseOnly ? runner.checkFile(file, json) : runner.runScript(file);
        }
        if (parseOnly) {
            err.println("error: --parse-only requires a file");
            return ScriptRunner.EXIT_IO;
        }
        new ReplRunner(sessionConfig(true), out, err).run();
        return ScriptRunner.EXIT_OK;
    }

    SessionConfig sessionConfig(boolean repl) {
        return SessionConfig.builder()
                .jitEnabled(jit)
                .maxCallDepth(maxDepth)
                .randomSeed(seed)
                .replMode(repl)
                .out(out)
                .build();
    }

    PrintStream getOut() {
        return out;
    }

    PrintStream getErr() {
        return err;
    }

    /** 构建命令行；测试直接调用 execute */
    static CommandLine commandLine(Main main) {
        CommandLine cmd = new CommandLine(main);
        cmd.setParameterExceptionHandler(new CommandLine.IParameterExceptionHandler() {
            @Override
            public int handleParseException(CommandLine.ParameterException ex, String[] args) {
                CommandLine failed = ex.getCommandLine();
                failed.getErr().println("error: " + ex.getMessage());
                failed.usage(failed.getErr());
                return ScriptRunner.EXIT_IO;
            }
        });
        return cmd;
    }

    public static void main(String[] args) {
        // Windows 控制台可能仍用 GBK
        String charsetName = getConsoleCharsetName();
        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = commandLine(new Main(out, err));
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(commandLine(new Main()).execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名（native.encoding，JDK 17+）
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
