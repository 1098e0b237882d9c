package com.matrixlang.compiler.ast.stmt;

import com.matrixlang.compiler.ast.AstNode;
import com.matrixlang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
