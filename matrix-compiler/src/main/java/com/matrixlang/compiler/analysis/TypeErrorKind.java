package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.diagnostic.ErrorKind;

/**
 * 类型错误种类
 */
public enum TypeErrorKind implements ErrorKind {
    Mismatch,
    InfiniteType,
    UnknownIdentifier,
    ArityMismatch,
    ImmutableAssignment;

    @Override
    public String category() {
        return "TypeError";
    }
}
