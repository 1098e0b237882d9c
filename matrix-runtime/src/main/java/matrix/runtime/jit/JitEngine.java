package matrix.runtime.jit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.matrixlang.compiler.ast.expr.LambdaExpr;

import java.util.logging.Logger;

/**
 * 第一次调用时判定并编译 let 绑定的 lambda，结果按 lambda 节点缓存
 *
 * <p>编译失败只记 FINE 日志，该 lambda 此后一直解释执行。</p>
 */
public final class JitEngine {

    private static final Logger LOG = Logger.getLogger(JitEngine.class.getName());

    /** 缓存条目；不可编译时 function 为 null */
    private static final class Entry {
        final JitDecision decision;
        final CompiledFunction function;

        Entry(JitDecision decision, CompiledFunction function) {
            this.decision = decision;
            this.function = function;
        }
    }

    private final Cache<LambdaExpr, Entry> cache;
    private final CallDepthGuard guard;

    public JitEngine(long cacheSize, CallDepthGuard guard) {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .recordStats()
                .build();
        this.guard = guard;
    }

    /**
     * @return 编译后的函数；不可编译时返回 null
     */
    public CompiledFunction lookup(String name, LambdaExpr lambda) {
        return cache.get(lambda, key -> compile(name, key)).function;
    }

    /** 已作出的判定；尚未调用过时返回 null */
    public JitDecision decisionOf(LambdaExpr lambda) {
        Entry entry = cache.getIfPresent(lambda);
        return entry != null ? entry.decision : null;
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    private Entry compile(String name, LambdaExpr lambda) {
        JitDecision decision = JitEligibilityAnalyzer.analyze(name, lambda);
        if (!decision.isEligible()) {
            LOG.fine("JIT skipped '" + name + "': " + decision.getReason());
            return new Entry(decision, null);
        }
        try {
            CompiledFunction function = ClosureCompiler.compile(name, lambda, guard);
            LOG.fine("JIT compiled '" + name + "'/" + lambda.getArity());
            return new Entry(decision, function);
        } catch (RuntimeException e) {
            LOG.fine("JIT compilation of '" + name + "' failed: " + e.getMessage());
            return new Entry(JitDecision.rejected(e.getMessage()), null);
        }
    }
}
