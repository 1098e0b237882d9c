package com.matrixlang.compiler.diagnostic;

import com.matrixlang.compiler.ast.SourceLocation;

/**
 * 所有诊断异常的基类
 *
 * <p>消息格式固定为 {@code "<Kind>: <message> at line L, column C"}。</p>
 */
public abstract class MatrixLangException extends RuntimeException {

    private final ErrorKind kind;
    private final String rawMessage;
    private final SourceLocation location;

    protected MatrixLangException(ErrorKind kind, String message, SourceLocation location) {
        super(format(kind, message, location));
        this.kind = kind;
        this.rawMessage = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    protected MatrixLangException(ErrorKind kind, String message, SourceLocation location, Throwable cause) {
        this(kind, message, location);
        initCause(cause);
    }

    static String format(ErrorKind kind, String message, SourceLocation location) {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.name()).append(": ").append(message);
        if (location != null && location.getLine() > 0) {
            sb.append(" at line ").append(location.getLine())
              .append(", column ").append(location.getColumn());
        }
        return sb.toString();
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCategory() {
        return kind.category();
    }

    /** 不带种类前缀和位置的原始消息 */
    public String getRawMessage() {
        return rawMessage;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getLine() {
        return location.getLine();
    }

    public int getColumn() {
        return location.getColumn();
    }

    /**
     * 带源码行与列指示符的多行显示
     */
    public String formatWithSource(String source) {
        StringBuilder sb = new StringBuilder(getCategory()).append(" ").append(getMessage());
        if (source == null || location.getLine() <= 0) return sb.toString();
        String[] lines = source.split("\n", -1);
        if (location.getLine() > lines.length) return sb.toString();
        String lineText = lines[location.getLine() - 1];
        String lineNum = String.valueOf(location.getLine());
        sb.append("\n ").append(lineNum).append(" | ").append(lineText);
        sb.append("\n ");
        for (int i = 0; i < lineNum.length(); i++) sb.append(' ');
        sb.append(" | ");
        for (int i = 1; i < location.getColumn(); i++) {
            sb.append(i - 1 < lineText.length() && lineText.charAt(i - 1) == '\t' ? '\t' : ' ');
        }
        sb.append('^');
        return sb.toString();
    }
}
