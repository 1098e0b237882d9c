package com.matrixlang.compiler.parser;

import com.matrixlang.compiler.diagnostic.MatrixLangException;
import com.matrixlang.compiler.lexer.Token;

/**
 * 解析异常
 */
public class ParseException extends MatrixLangException {
    private final Token token;
    private final String expected;

    private ParseException(ParseErrorKind kind, String message, Token token, String expected) {
        super(kind, message, token.getLocation());
        this.token = token;
        this.expected = expected;
    }

    /** 期望 expected 但遇到了 found */
    public static ParseException unexpected(String expected, Token found) {
        return new ParseException(ParseErrorKind.UnexpectedToken,
                "expected " + expected + ", found " + found.describe(), found, expected);
    }

    /** 结构在输入结束前未闭合；位置为结构起点 */
    public static ParseException unterminated(String construct, Token opener, String expected) {
        return new ParseException(ParseErrorKind.UnterminatedConstruct,
                "unterminated " + construct + " starting on line " + opener.getLine()
                        + ", expected " + expected, opener, expected);
    }

    @Override
    public ParseErrorKind getKind() {
        return (ParseErrorKind) super.getKind();
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }
}
