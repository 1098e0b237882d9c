package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.decl.Parameter;
import com.matrixlang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * Lambda 表达式 {@code (a: Int, b) -> Int => body}
 */
public final class LambdaExpr extends Expression {
    private final List<Parameter> params;
    private final TypeRef returnType;  // 可为 null
    private final Expression body;

    public LambdaExpr(SourceLocation location, List<Parameter> params, TypeRef returnType, Expression body) {
        super(location);
        this.params = params;
        this.returnType = returnType;
        this.body = body;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public Expression getBody() {
        return body;
    }

    public int getArity() {
        return params.size();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }
}
