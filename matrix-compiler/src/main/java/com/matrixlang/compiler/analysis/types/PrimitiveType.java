package com.matrixlang.compiler.analysis.types;

/**
 * 基本类型：Int、Float、Bool、String、Unit
 */
public final class PrimitiveType extends MxType {

    public static final PrimitiveType INT = new PrimitiveType("Int");
    public static final PrimitiveType FLOAT = new PrimitiveType("Float");
    public static final PrimitiveType BOOL = new PrimitiveType("Bool");
    public static final PrimitiveType STRING = new PrimitiveType("String");
    public static final PrimitiveType UNIT = new PrimitiveType("Unit");

    private final String name;

    private PrimitiveType(String name) {
        this.name = name;
    }

    /** 按名称查找基本类型，未知返回 null */
    public static PrimitiveType byName(String name) {
        switch (name) {
            case "Int": return INT;
            case "Float": return FLOAT;
            case "Bool": return BOOL;
            case "String": return STRING;
            case "Unit": return UNIT;
            default: return null;
        }
    }

    public String getName() {
        return name;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    @Override
    public String getHeadName() {
        return name;
    }

    @Override
    public <R> R accept(MxTypeVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
