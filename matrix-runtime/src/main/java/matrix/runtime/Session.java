package matrix.runtime;

import com.matrixlang.compiler.analysis.CheckResult;
import com.matrixlang.compiler.analysis.TypeChecker;
import com.matrixlang.compiler.analysis.TypeEnvironment;
import com.matrixlang.compiler.ast.Program;
import com.matrixlang.compiler.ast.expr.Expression;
import com.matrixlang.compiler.parser.Parser;
import matrix.runtime.collab.HandleTable;
import matrix.runtime.interpreter.Interpreter;
import matrix.runtime.interpreter.builtin.BuiltinRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 一个独立的语言会话
 *
 * <p>持有自己的内置函数表、类型检查器、解释器和句柄表，多个会话互不影响。
 * 每次输入先完整通过词法、语法和类型检查才开始求值；任何一步失败，该输入的类型绑定和值绑定都不会生效。</p>
 *
 * <pre>
 * Session session = new Session();
 * session.evalRepl("let x = 5 + 3");
 * session.evalRepl("x * 2").getValue();   // 16
 * </pre>
 */
public final class Session {

    private static final Logger LOG = Logger.getLogger(Session.class.getName());

    static final String REPL_FILE = "<repl>";

    private final SessionConfig config;
    private final BuiltinRegistry registry;
    private final TypeChecker checker;
    private final Interpreter interpreter;

    public Session() {
        this(SessionConfig.defaults());
    }

    public Session(SessionConfig config) {
        this(config, BuiltinRegistry.withStandardLibrary());
    }

    /**
     * @param registry 会话专用的内置函数表；在此之后登记的函数同样可见
     */
    public Session(SessionConfig config, BuiltinRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.checker = new TypeChecker(registry);
        this.interpreter = new Interpreter(registry, config);
        LOG.fine("new session (jit=" + config.isJitEnabled() + ", repl=" + config.isReplMode() + ")");
    }

    /**
     * 只做词法、语法和类型检查，不提交任何绑定
     *
     * @throws com.matrixlang.compiler.diagnostic.MatrixLangException 静态错误
     */
    public CheckResult check(String source, String fileName) {
        Program program = new Parser(source, fileName).parse();
        CheckResult result = checker.check(program);
        checker.rollback(result);
        return result;
    }

    /**
     * 运行一段程序并返回最后一条语句的值
     *
     * <p>非 REPL 模式下每次运行都从空白会话开始；REPL 模式下与 {@link #evalRepl} 一样累积绑定。</p>
     */
    public MxValue run(String source, String fileName) {
        if (!config.isReplMode()) {
            reset();
        }
        return execute(source, fileName).getValue();
    }

    /**
     * 求值一条 REPL 输入。成功时新绑定对之后的输入可见；失败时会话保持输入前的状态。
     */
    public ReplResult evalRepl(String source) {
        return execute(source, REPL_FILE);
    }

    private ReplResult execute(String source, String fileName) {
        Program program = new Parser(source, fileName).parse();
        CheckResult checked = checker.check(program);
        Interpreter.Evaluation evaluation;
        try {
            evaluation = interpreter.evaluate(program, checked.getAnnotations());
        } catch (RuntimeException e) {
            checker.rollback(checked);
            LOG.fine("entry rolled back: " + e.getMessage());
            throw e;
        }
        checker.commit(checked);
        interpreter.commit(evaluation);
        LOG.fine("entry committed, " + checked.getBindings().size() + " new binding(s)");
        return new ReplResult(evaluation.getValue(), checked.getType().toDisplayString(),
                checked.getBindingTypes());
    }

    /**
     * 在当前已提交的作用域中推断表达式的类型
     */
    public String typeOf(String expression) {
        Expression expr = new Parser(expression, REPL_FILE).parseStandaloneExpression();
        return checker.typeOf(expr).toDisplayString();
    }

    /**
     * 当前可见的顶层绑定：名字 → "值 : 类型"
     */
    public Map<String, String> describeBindings() {
        Map<String, String> result = new LinkedHashMap<String, String>();
        TypeEnvironment types = checker.getEnvironment();
        for (Map.Entry<String, MxValue> e : interpreter.getGlobals().getVisibleBindings().entrySet()) {
            TypeEnvironment.Binding binding = types.lookup(e.getKey());
            String type = binding != null ? binding.getScheme().toDisplayString() : "?";
            result.put(e.getKey(), e.getValue().toDisplayString() + " : " + type);
        }
        return result;
    }

    /** 丢弃所有用户绑定；内置函数保留 */
    public void reset() {
        checker.reset();
        interpreter.reset();
        LOG.fine("session reset");
    }

    public SessionConfig getConfig() {
        return config;
    }

    public BuiltinRegistry getRegistry() {
        return registry;
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    public HandleTable getHandles() {
        return interpreter.getHandles();
    }
}
