package com.matrixlang.compiler.analysis.types;

/**
 * MxType 访问者接口，用于替代 instanceof 分派。
 */
public interface MxTypeVisitor<R> {
    R visitPrimitive(PrimitiveType type);
    R visitArray(ArrayType type);
    R visitMatrix(MatrixType type);
    R visitFunction(FunctionType type);
    R visitStruct(StructType type);
    R visitOpaque(OpaqueType type);
    R visitVariable(TypeVariable type);
}
