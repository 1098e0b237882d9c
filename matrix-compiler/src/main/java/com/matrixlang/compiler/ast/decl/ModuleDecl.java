package com.matrixlang.compiler.ast.decl;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 模块声明：成员通过 {@code Module.member} 访问
 */
public final class ModuleDecl extends Declaration {
    private final String name;
    private final List<Statement> body;

    public ModuleDecl(SourceLocation location, String name, List<Statement> body) {
        super(location);
        this.name = name;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDecl(this, context);
    }
}
