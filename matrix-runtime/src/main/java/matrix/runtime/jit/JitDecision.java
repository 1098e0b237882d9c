package matrix.runtime.jit;

/**
 * 可编译性判定结果
 */
public final class JitDecision {

    private static final JitDecision ELIGIBLE = new JitDecision(true, "eligible");

    private final boolean eligible;
    private final String reason;

    private JitDecision(boolean eligible, String reason) {
        this.eligible = eligible;
        this.reason = reason;
    }

    public static JitDecision eligible() {
        return ELIGIBLE;
    }

    public static JitDecision rejected(String reason) {
        return new JitDecision(false, reason);
    }

    public boolean isEligible() {
        return eligible;
    }

    /** 不可编译时为第一个不支持的构造 */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return eligible ? "JitDecision{eligible}" : "JitDecision{rejected: " + reason + "}";
    }
}
