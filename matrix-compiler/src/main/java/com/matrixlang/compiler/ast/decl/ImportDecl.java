package com.matrixlang.compiler.ast.decl;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 导入声明：{@code import M}、{@code import M.x} 或 {@code import M.{a, b}}
 */
public final class ImportDecl extends Declaration {
    private final String moduleName;
    private final List<String> items;  // null 表示导入全部

    public ImportDecl(SourceLocation location, String moduleName, List<String> items) {
        super(location);
        this.moduleName = moduleName;
        this.items = items;
    }

    public String getModuleName() {
        return moduleName;
    }

    public List<String> getItems() {
        return items;
    }

    public boolean isWildcard() {
        return items == null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }
}
