package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 结构体字面量 {@code Point { x: 1.0, y: 2.0 }}
 */
public final class StructLiteral extends Expression {
    private final String structName;
    private final List<FieldInit> fields;

    public StructLiteral(SourceLocation location, String structName, List<FieldInit> fields) {
        super(location);
        this.structName = structName;
        this.fields = fields;
    }

    public String getStructName() {
        return structName;
    }

    public List<FieldInit> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructLiteral(this, context);
    }
}
