package com.matrixlang.compiler.ast.decl;

import com.matrixlang.compiler.ast.AstNode;
import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.expr.Expression;
import com.matrixlang.compiler.ast.type.TypeRef;

/**
 * 结构体字段声明
 */
public final class StructField extends AstNode {
    private final String name;
    private final TypeRef type;
    private final Expression defaultValue;  // 可为 null

    public StructField(SourceLocation location, String name, TypeRef type, Expression defaultValue) {
        super(location);
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructField(this, context);
    }
}
