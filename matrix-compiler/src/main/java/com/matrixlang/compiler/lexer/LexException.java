package com.matrixlang.compiler.lexer;

import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.diagnostic.MatrixLangException;

/**
 * 词法错误（遇到第一个错误即停止）
 */
public class LexException extends MatrixLangException {

    private final Character offendingChar;

    public LexException(LexErrorKind kind, String message, SourceLocation location) {
        this(kind, message, location, null);
    }

    public LexException(LexErrorKind kind, String message, SourceLocation location, Character offendingChar) {
        super(kind, message, location);
        this.offendingChar = offendingChar;
    }

    @Override
    public LexErrorKind getKind() {
        return (LexErrorKind) super.getKind();
    }

    /** InvalidCharacter 时的非法字符，其余为 null */
    public Character getOffendingChar() {
        return offendingChar;
    }
}
