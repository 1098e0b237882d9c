package com.matrixlang.compiler.analysis.types;

/**
 * 运算符约束关心的类型形状
 */
public enum TypeShape {
    INT,
    FLOAT,
    STRING,
    MATRIX;

    /** 具体类型的形状；不参与运算符约束的类型返回 null */
    public static TypeShape of(MxType type) {
        if (type == PrimitiveType.INT) return INT;
        if (type == PrimitiveType.FLOAT) return FLOAT;
        if (type == PrimitiveType.STRING) return STRING;
        if (type instanceof MatrixType) return MATRIX;
        return null;
    }
}
