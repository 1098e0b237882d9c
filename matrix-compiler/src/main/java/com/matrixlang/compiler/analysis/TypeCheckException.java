package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.diagnostic.MatrixLangException;

/**
 * 类型检查失败。检查在第一个错误处停止，程序不会被求值。
 */
public class TypeCheckException extends MatrixLangException {

    // UnknownIdentifier 时为标识符名，Mismatch 时为期望/实际类型
    private final String subject;
    private final String found;

    public TypeCheckException(TypeErrorKind kind, String message, SourceLocation location) {
        this(kind, message, location, null, null);
    }

    public TypeCheckException(TypeErrorKind kind, String message, SourceLocation location,
                              String subject, String found) {
        super(kind, message, location);
        this.subject = subject;
        this.found = found;
    }

    public static TypeCheckException mismatch(String expected, String found, SourceLocation location) {
        return new TypeCheckException(TypeErrorKind.Mismatch,
                "expected " + expected + ", found " + found, location, expected, found);
    }

    public static TypeCheckException unknownIdentifier(String name, SourceLocation location) {
        return new TypeCheckException(TypeErrorKind.UnknownIdentifier,
                "unknown identifier '" + name + "'", location, name, null);
    }

    public static TypeCheckException arity(String message, SourceLocation location) {
        return new TypeCheckException(TypeErrorKind.ArityMismatch, message, location);
    }

    @Override
    public TypeErrorKind getKind() {
        return (TypeErrorKind) super.getKind();
    }

    /** UnknownIdentifier 的名字；Mismatch 的期望类型 */
    public String getSubject() {
        return subject;
    }

    /** Mismatch 的实际类型 */
    public String getFound() {
        return found;
    }
}
