package com.matrixlang.compiler.ast.decl;

import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.stmt.Statement;

/**
 * 声明基类（结构体、类型类、实例、模块、导入）
 */
public abstract class Declaration extends Statement {

    protected Declaration(SourceLocation location) {
        super(location);
    }
}
