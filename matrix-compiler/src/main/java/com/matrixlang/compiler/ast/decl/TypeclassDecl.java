package com.matrixlang.compiler.ast.decl;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 类型类声明 {@code typeclass Show<T> { show: (T) -> String }}
 */
public final class TypeclassDecl extends Declaration {
    private final String name;
    private final String typeParameter;
    private final List<MethodSignature> methods;

    public TypeclassDecl(SourceLocation location, String name, String typeParameter, List<MethodSignature> methods) {
        super(location);
        this.name = name;
        this.typeParameter = typeParameter;
        this.methods = methods;
    }

    public String getName() {
        return name;
    }

    public String getTypeParameter() {
        return typeParameter;
    }

    public List<MethodSignature> getMethods() {
        return methods;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeclassDecl(this, context);
    }
}
