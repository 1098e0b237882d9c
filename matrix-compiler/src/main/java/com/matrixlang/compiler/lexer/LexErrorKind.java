package com.matrixlang.compiler.lexer;

import com.matrixlang.compiler.diagnostic.ErrorKind;

/**
 * 词法错误种类
 */
public enum LexErrorKind implements ErrorKind {
    UnterminatedString,
    InvalidCharacter,
    InvalidNumber,
    UnterminatedComment;

    @Override
    public String category() {
        return "LexError";
    }
}
