package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstNode;
import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.pattern.Pattern;

/**
 * match 分支：{@code pattern if guard => body}
 */
public final class MatchArm extends AstNode {
    private final Pattern pattern;
    private final Expression guard;  // 可为 null
    private final Expression body;

    public MatchArm(SourceLocation location, Pattern pattern, Expression guard, Expression body) {
        super(location);
        this.pattern = pattern;
        this.guard = guard;
        this.body = body;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Expression getGuard() {
        return guard;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMatchArm(this, context);
    }
}
