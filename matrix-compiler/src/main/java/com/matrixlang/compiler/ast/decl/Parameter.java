package com.matrixlang.compiler.ast.decl;

import com.matrixlang.compiler.ast.AstNode;
import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.type.TypeRef;

/**
 * 函数参数
 */
public final class Parameter extends AstNode {
    private final String name;
    private final TypeRef type;  // 可为 null

    public Parameter(SourceLocation location, String name, TypeRef type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public boolean hasType() {
        return type != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
