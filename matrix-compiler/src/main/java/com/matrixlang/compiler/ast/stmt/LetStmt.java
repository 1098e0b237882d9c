package com.matrixlang.compiler.ast.stmt;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.expr.Expression;
import com.matrixlang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * let 绑定语句
 *
 * <p>{@code let} 不可变，{@code let mut} 可重新赋值。绑定 lambda 时允许递归引用自身。</p>
 */
public final class LetStmt extends Statement {
    private final String name;
    private final boolean mutable;
    private final TypeRef typeAnnotation;  // 可为 null
    private final Expression value;
    private final List<String> attributes;

    public LetStmt(SourceLocation location, String name, boolean mutable, TypeRef typeAnnotation, Expression value, List<String> attributes) {
        super(location);
        this.name = name;
        this.mutable = mutable;
        this.typeAnnotation = typeAnnotation;
        this.value = value;
        this.attributes = attributes;
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

    public List<String> getAttributes() {
        return attributes;
    }

    public boolean hasAttribute(String attribute) {
        return attributes.contains(attribute);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }
}
