package com.matrixlang.compiler.ast.pattern;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 结构体模式 {@code Point { x: px, y }}
 */
public final class StructPattern extends Pattern {
    private final String structName;
    private final List<FieldPattern> fields;

    public StructPattern(SourceLocation location, String structName, List<FieldPattern> fields) {
        super(location);
        this.structName = structName;
        this.fields = fields;
    }

    public String getStructName() {
        return structName;
    }

    public List<FieldPattern> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructPattern(this, context);
    }
}
