package com.matrixlang.compiler.ast.decl;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 结构体声明
 */
public final class StructDecl extends Declaration {
    private final String name;
    private final List<StructField> fields;

    public StructDecl(SourceLocation location, String name, List<StructField> fields) {
        super(location);
        this.name = name;
        this.fields = fields;
    }

    public String getName() {
        return name;
    }

    public List<StructField> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}
