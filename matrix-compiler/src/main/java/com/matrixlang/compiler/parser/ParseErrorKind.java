package com.matrixlang.compiler.parser;

import com.matrixlang.compiler.diagnostic.ErrorKind;

/**
 * 语法错误种类
 */
public enum ParseErrorKind implements ErrorKind {
    UnexpectedToken,
    UnterminatedConstruct;

    @Override
    public String category() {
        return "ParseError";
    }
}
