package matrix.runtime;

import java.io.PrintStream;

/**
 * 会话配置（不可变）
 *
 * <pre>
 * SessionConfig config = SessionConfig.builder()
 *         .jitEnabled(true)
 *         .randomSeed(42L)
 *         .build();
 * </pre>
 */
public final class SessionConfig {

    public static final int DEFAULT_MAX_CALL_DEPTH = 2000;
    public static final int DEFAULT_JIT_CACHE_SIZE = 256;

    private final boolean jitEnabled;
    private final boolean replMode;
    private final int maxCallDepth;
    private final PrintStream out;
    private final Long randomSeed;
    private final int jitCacheSize;

    private SessionConfig(Builder builder) {
        this.jitEnabled = builder.jitEnabled;
        this.replMode = builder.replMode;
        this.maxCallDepth = builder.maxCallDepth;
        this.out = builder.out;
        this.randomSeed = builder.randomSeed;
        this.jitCacheSize = builder.jitCacheSize;
    }

    /** 全部取默认值 */
    public static SessionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isJitEnabled() {
        return jitEnabled;
    }

    public boolean isReplMode() {
        return replMode;
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    public PrintStream getOut() {
        return out;
    }

    /** 未设置时为 null */
    public Long getRandomSeed() {
        return randomSeed;
    }

    public int getJitCacheSize() {
        return jitCacheSize;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.jitEnabled = jitEnabled;
        builder.replMode = replMode;
        builder.maxCallDepth = maxCallDepth;
        builder.out = out;
        builder.randomSeed = randomSeed;
        builder.jitCacheSize = jitCacheSize;
        return builder;
    }

    // ============ Builder ============

    public static final class Builder {
        private boolean jitEnabled = false;
        private boolean replMode = false;
        private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
        private PrintStream out = System.out;
        private Long randomSeed;
        private int jitCacheSize = DEFAULT_JIT_CACHE_SIZE;

        Builder() {
        }

        public Builder jitEnabled(boolean enabled) {
            this.jitEnabled = enabled;
            return this;
        }

        public Builder replMode(boolean replMode) {
            this.replMode = replMode;
            return this;
        }

        public Builder maxCallDepth(int depth) {
            if (depth <= 0) {
                throw new IllegalArgumentException("maxCallDepth must be positive, got " + depth);
            }
            this.maxCallDepth = depth;
            return this;
        }

        public Builder out(PrintStream out) {
            if (out == null) {
                throw new IllegalArgumentException("out must not be null");
            }
            this.out = out;
            return this;
        }

        public Builder randomSeed(Long seed) {
            this.randomSeed = seed;
            return this;
        }

        public Builder jitCacheSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("jitCacheSize must be positive, got " + size);
            }
            this.jitCacheSize = size;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(this);
        }
    }
}
