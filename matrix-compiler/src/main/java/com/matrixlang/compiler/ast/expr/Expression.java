package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstNode;
import com.matrixlang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
