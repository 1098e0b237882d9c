package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.type.TypeRef;

/**
 * let-in 表达式：{@code let x = e in body}
 */
public final class LetExpr extends Expression {
    private final String name;
    private final boolean mutable;
    private final TypeRef typeAnnotation;  // 可为 null
    private final Expression value;
    private final Expression body;

    public LetExpr(SourceLocation location, String name, boolean mutable, TypeRef typeAnnotation, Expression value, Expression body) {
        super(location);
        this.name = name;
        this.mutable = mutable;
        this.typeAnnotation = typeAnnotation;
        this.value = value;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public boolean isMutable() {
        return mutable;
    }

    public TypeRef getTypeAnnotation() {
        return typeAnnotation;
    }

    public Expression getValue() {
        return value;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetExpr(this, context);
    }
}
