package com.matrixlang.cli;

import com.matrixlang.compiler.diagnostic.MatrixLangException;
import matrix.runtime.ReplResult;
import matrix.runtime.Session;
import matrix.runtime.SessionConfig;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * jline REPL 交互模式
 *
 * <p>每条输入要么整体提交，要么在出错时整体丢弃；之前的绑定保持不变。</p>
 */
public class ReplRunner {

    private static final Logger LOG = Logger.getLogger(ReplRunner.class.getName());

    private static final String VERSION = "0.1.0";
    private static final String PROMPT = "matrix> ";
    private static final String CONTINUATION_PROMPT = "... ";

    private final Session session;
    private final PrintStream out;
    private final PrintStream err;

    private final StringBuilder multilineBuffer = new StringBuilder();

    public ReplRunner(SessionConfig config, PrintStream out, PrintStream err) {
        this.session = new Session(config.toBuilder().replMode(true).out(out).build());
        this.out = out;
        this.err = err;
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        printBanner();
        out.println("输入 :help 获取帮助，:quit 退出");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, CONTINUATION_PROMPT)
                    .build();
            runLoop(reader);
        } catch (IOException e) {
            LOG.log(Level.FINE, "terminal init failed", e);
            err.println("终端初始化失败: " + e.getMessage());
            runFallbackLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }

        out.println();
        out.println("再见！");
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        while (true) {
            try {
                String line = reader.readLine(currentPrompt());
                if (line == null || !acceptLine(line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                multilineBuffer.setLength(0);
            } catch (EndOfFileException e) {
                break;
            }
        }
    }

    /**
     * 回退循环（jline 不可用或输入被重定向时）
     */
    void runFallbackLoop(BufferedReader reader) {
        while (true) {
            out.print(currentPrompt());
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                err.println("读取输入时出错: " + e.getMessage());
                break;
            }
            if (line == null || !acceptLine(line)) break;
        }
    }

    String currentPrompt() {
        return multilineBuffer.length() > 0 ? CONTINUATION_PROMPT : PROMPT;
    }

    /**
     * 处理一行输入：REPL 命令、续行或求值
     *
     * @return false 表示退出
     */
    boolean acceptLine(String line) {
        boolean inMultiline = multilineBuffer.length() > 0;
        if (!inMultiline && line.trim().startsWith(":")) {
            return handleReplCommand(line.trim());
        }

        // 反斜杠续行
        if (line.endsWith("\\")) {
            multilineBuffer.append(line, 0, line.length() - 1).append("\n");
            return true;
        }

        // 未闭合括号自动续行
        if (hasUnclosedBrackets(multilineBuffer + line)) {
            multilineBuffer.append(line).append("\n");
            return true;
        }

        String source = line;
        if (inMultiline) {
            source = multilineBuffer.append(line).toString();
            multilineBuffer.setLength(0);
        }
        if (!source.trim().isEmpty()) {
            evaluateAndPrint(source);
        }
        return true;
    }

    /**
     * 检查是否有未闭合的括号（忽略字符串与 -- 注释）
     */
    static boolean hasUnclosedBrackets(String text) {
        int braces = 0;
        int parens = 0;
        int brackets = 0;
        boolean inString = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
                continue;
            }
            if (c == '-' && i + 1 < text.length() && text.charAt(i + 1) == '-') {
                while (i < text.length() && text.charAt(i) != '\n') i++;
                continue;
            }

            switch (c) {
                case '{': braces++; break;
                case '}': braces--; break;
                case '(': parens++; break;
                case ')': parens--; break;
                case '[': brackets++; break;
                case ']': brackets--; break;
                default: break;
            }
        }

        return braces > 0 || parens > 0 || brackets > 0;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    boolean handleReplCommand(String command) {
        if (":quit".equals(command) || ":q".equals(command) || ":exit".equals(command)) {
            return false;
        }

        if (":help".equals(command) || ":h".equals(command)) {
            printReplHelp();
            return true;
        }

        if (":version".equals(command)) {
            out.println("matrix-lang v" + VERSION);
            out.println("Java: " + System.getProperty("java.version"));
            return true;
        }

        if (":reset".equals(command)) {
            session.reset();
            out.println("环境已重置");
            return true;
        }

        if (":env".equals(command)) {
            Map<String, String> bindings = session.describeBindings();
            if (bindings.isEmpty()) {
                out.println("(无绑定)");
            }
            for (Map.Entry<String, String> e : bindings.entrySet()) {
                out.println(e.getKey() + " = " + e.getValue());
            }
            return true;
        }

        if (command.startsWith(":type ") || command.startsWith(":t ")) {
            String expr = command.substring(command.indexOf(' ') + 1).trim();
            try {
                out.println(expr + " : " + session.typeOf(expr));
            } catch (MatrixLangException e) {
                err.println(e.formatWithSource(expr));
            }
            return true;
        }

        out.println("未知命令: " + command);
        out.println("输入 :help 获取帮助");
        return true;
    }

    /**
     * 求值并打印 "值 : 类型"；Unit 不打印
     */
    void evaluateAndPrint(String source) {
        try {
            ReplResult result = session.evalRepl(source);
            if (!result.isUnit()) {
                out.println(result.toDisplayString());
            }
        } catch (MatrixLangException e) {
            err.println(e.formatWithSource(source));
        }
    }

    Session getSession() {
        return session;
    }

    private void printBanner() {
        out.println("matrix-lang v" + VERSION + " - 矩阵与数值计算脚本语言");
        out.println();
    }

    private void printReplHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h         显示此帮助");
        out.println("  :quit, :q, :exit  退出 REPL");
        out.println("  :type, :t <expr>  显示表达式的类型");
        out.println("  :env              显示当前绑定");
        out.println("  :reset            清除所有用户绑定");
        out.println("  :version          显示版本");
        out.println();
        out.println("示例:");
        out.println("  let x = 42                 不可变绑定");
        out.println("  let mut n = 0              可变绑定");
        out.println("  fn sq(x) = x * x           定义函数");
        out.println("  [[1.0, 2.0], [3.0, 4.0]]   矩阵字面量");
        out.println();
        out.println("提示:");
        out.println("  - 行尾使用 \\ 可以输入多行");
        out.println("  - 未闭合的括号会自动进入多行模式");
    }
}
