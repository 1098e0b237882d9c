package com.matrixlang.compiler.analysis.types;

import java.util.HashMap;
import java.util.Map;

/**
 * 类型显示
 *
 * <p>给定命名表时，类型变量按表中名字显示（用于类型方案的 a、b、c 显示），否则显示为 t&lt;id&gt;。</p>
 */
public final class TypePrinter implements MxTypeVisitor<String> {

    private final Map<Integer, String> names;

    public TypePrinter() {
        this(new HashMap<Integer, String>());
    }

    public TypePrinter(Map<Integer, String> names) {
        this.names = names;
    }

    public String print(MxType type) {
        return type.accept(this);
    }

    /** 第 index 个量化变量的显示名：a..z, a1.. */
    public static String letterName(int index) {
        char letter = (char) ('a' + index % 26);
        int round = index / 26;
        return round == 0 ? String.valueOf(letter) : letter + String.valueOf(round);
    }

    @Override
    public String visitPrimitive(PrimitiveType type) {
        return type.getName();
    }

    @Override
    public String visitArray(ArrayType type) {
        return "[" + print(type.getElementType()) + "]";
    }

    @Override
    public String visitMatrix(MatrixType type) {
        return "Matrix<" + print(type.getElementType()) + ">";
    }

    @Override
    public String visitFunction(FunctionType type) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < type.getParamTypes().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(print(type.getParamTypes().get(i)));
        }
        return sb.append(") -> ").append(print(type.getReturnType())).toString();
    }

    @Override
    public String visitStruct(StructType type) {
        return type.getName();
    }

    @Override
    public String visitOpaque(OpaqueType type) {
        if (type.getTypeArgs().isEmpty()) return type.getName();
        StringBuilder sb = new StringBuilder(type.getName()).append('<');
        for (int i = 0; i < type.getTypeArgs().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(print(type.getTypeArgs().get(i)));
        }
        return sb.append('>').toString();
    }

    @Override
    public String visitVariable(TypeVariable type) {
        String name = names.get(type.getId());
        return name != null ? name : "t" + type.getId();
    }
}
