package com.matrixlang.compiler.diagnostic;

/**
 * 诊断种类：类别（LexError / ParseError / TypeError / RuntimeError）+ 具体种类名
 */
public interface ErrorKind {

    /** 错误类别名，如 "TypeError" */
    String category();

    /** 具体种类名，如 "UnknownIdentifier" */
    String name();
}
