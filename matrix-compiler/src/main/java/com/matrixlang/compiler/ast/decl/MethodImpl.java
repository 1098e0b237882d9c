package com.matrixlang.compiler.ast.decl;

import com.matrixlang.compiler.ast.AstNode;
import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.expr.Expression;

/**
 * 实例中的方法实现
 */
public final class MethodImpl extends AstNode {
    private final String name;
    private final Expression value;

    public MethodImpl(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodImpl(this, context);
    }
}
