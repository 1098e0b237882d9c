package com.matrixlang.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.matrixlang.compiler.analysis.CheckResult;
import com.matrixlang.compiler.diagnostic.MatrixLangException;
import matrix.runtime.MxRuntimeException;
import matrix.runtime.MxValue;
import matrix.runtime.Session;
import matrix.runtime.SessionConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 脚本、表达式与类型检查的执行器
 *
 * <p>返回进程退出码：0 成功，1 诊断错误（词法、语法、类型、运行时），2 文件读取失败。</p>
 */
public class ScriptRunner {

    private static final Logger LOG = Logger.getLogger(ScriptRunner.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_DIAGNOSTIC = 1;
    static final int EXIT_IO = 2;

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final SessionConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public ScriptRunner(SessionConfig config, PrintStream out, PrintStream err) {
        this.config = config.toBuilder().out(out).build();
        this.out = out;
        this.err = err;
    }

    /**
     * 执行脚本文件，最终值不是 Unit 时打印
     */
    public int runScript(String filePath) {
        String source = readSource(filePath);
        if (source == null) return EXIT_IO;
        return evaluate(source, filePath);
    }

    /**
     * 执行单个表达式（-e）
     */
    public int runExpression(String expression) {
        return evaluate(expression, "<cmdline>");
    }

    private int evaluate(String source, String fileName) {
        try {
            MxValue result = new Session(config).run(source, fileName);
            if (!result.isUnit()) {
                out.println(result.toDisplayString());
            }
            return EXIT_OK;
        } catch (MatrixLangException e) {
            reportDiagnostic(e, source, fileName);
            return EXIT_DIAGNOSTIC;
        }
    }

    /**
     * 词法、语法与类型检查，不执行；打印每个顶层绑定的类型，json 为 true 时输出 JSON
     */
    public int checkFile(String filePath, boolean json) {
        String source = readSource(filePath);
        if (source == null) return EXIT_IO;
        try {
            CheckResult result = new Session(config).check(source, filePath);
            if (json) {
                out.println(GSON.toJson(toJson(filePath, result)));
            } else {
                for (Map.Entry<String, String> e : result.getBindingTypes().entrySet()) {
                    out.println(e.getKey() + " : " + e.getValue());
                }
            }
            return EXIT_OK;
        } catch (MatrixLangException e) {
            if (json) {
                out.println(GSON.toJson(errorJson(filePath, e)));
            } else {
                reportDiagnostic(e, source, filePath);
            }
            return EXIT_DIAGNOSTIC;
        }
    }

    static JsonObject toJson(String filePath, CheckResult result) {
        JsonObject root = new JsonObject();
        root.addProperty("file", filePath);
        root.addProperty("type", result.getType().toDisplayString());
        JsonObject bindings = new JsonObject();
        for (Map.Entry<String, String> e : result.getBindingTypes().entrySet()) {
            bindings.addProperty(e.getKey(), e.getValue());
        }
        root.add("bindings", bindings);
        return root;
    }

    static JsonObject errorJson(String filePath, MatrixLangException e) {
        JsonObject error = new JsonObject();
        error.addProperty("category", e.getCategory());
        error.addProperty("kind", e.getKind().name());
        error.addProperty("message", e.getRawMessage());
        error.addProperty("line", e.getLine());
        error.addProperty("column", e.getColumn());
        JsonObject root = new JsonObject();
        root.addProperty("file", filePath);
        root.add("error", error);
        return root;
    }

    /**
     * 打印诊断：文件位置、错误信息与出错的源码行
     */
    void reportDiagnostic(MatrixLangException e, String source, String fileName) {
        err.println(e.formatWithSource(source));
        if (e.getLine() > 0) {
            err.println("  --> " + fileName + ":" + e.getLine() + ":" + e.getColumn());
        }
        if (e instanceof MxRuntimeException && ((MxRuntimeException) e).getSubject() != null) {
            LOG.fine("runtime error in '" + ((MxRuntimeException) e).getSubject() + "'");
        }
    }

    private String readSource(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.isRegularFile(path)) {
            err.println("error: file not found - " + filePath);
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.FINE, "cannot read " + filePath, e);
            err.println("error: cannot read file - " + filePath + " (" + e.getMessage() + ")");
            return null;
        }
    }
}
