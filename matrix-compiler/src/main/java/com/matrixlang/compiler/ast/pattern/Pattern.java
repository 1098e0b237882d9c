package com.matrixlang.compiler.ast.pattern;

import com.matrixlang.compiler.ast.AstNode;
import com.matrixlang.compiler.ast.SourceLocation;

/**
 * match 模式基类
 */
public abstract class Pattern extends AstNode {

    protected Pattern(SourceLocation location) {
        super(location);
    }
}
