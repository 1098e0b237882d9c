package com.matrixlang.compiler.ast.type;

/**
 * 类型引用访问者
 */
public interface TypeRefVisitor<R> {

    R visitSimple(SimpleType type);

    R visitArray(ArrayTypeRef type);

    R visitFunction(FunctionTypeRef type);
}
