package com.matrixlang.compiler.ast.decl;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;
import com.matrixlang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 类型类实例 {@code instance Show<Int> { show = (x) => to_string(x) }}
 */
public final class InstanceDecl extends Declaration {
    private final String typeclassName;
    private final TypeRef instanceType;
    private final List<MethodImpl> methods;

    public InstanceDecl(SourceLocation location, String typeclassName, TypeRef instanceType, List<MethodImpl> methods) {
        super(location);
        this.typeclassName = typeclassName;
        this.instanceType = instanceType;
        this.methods = methods;
    }

    public String getTypeclassName() {
        return typeclassName;
    }

    public TypeRef getInstanceType() {
        return instanceType;
    }

    public List<MethodImpl> getMethods() {
        return methods;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInstanceDecl(this, context);
    }
}
