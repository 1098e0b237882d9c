package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.ArrayType;
import com.matrixlang.compiler.analysis.types.MxType;
import com.matrixlang.compiler.analysis.types.StructType;
import com.matrixlang.compiler.analysis.types.TypeScheme;
import com.matrixlang.compiler.analysis.types.TypeVariable;
import com.matrixlang.compiler.ast.pattern.*;

/**
 * 模式检查：按被匹配值的结构类型为模式中绑定的变量定型
 */
final class PatternChecker {

    private final TypeChecker checker;

    PatternChecker(TypeChecker checker) {
        this.checker = checker;
    }

    void check(Pattern pattern, MxType expected, TypeEnvironment scope) {
        if (pattern instanceof WildcardPattern) {
            return;
        }
        if (pattern instanceof BindingPattern) {
            scope.define(((BindingPattern) pattern).getName(), TypeScheme.mono(expected), false);
            return;
        }
        if (pattern instanceof LiteralPattern) {
            MxType literal = TypeChecker.literalType(((LiteralPattern) pattern).getLiteral());
            checker.unify(expected, literal, pattern.getLocation());
            return;
        }
        if (pattern instanceof StructPattern) {
            checkStruct((StructPattern) pattern, expected, scope);
            return;
        }
        if (pattern instanceof ArrayPattern) {
            TypeVariable element = checker.fresh();
            checker.unify(expected, new ArrayType(element), pattern.getLocation());
            for (Pattern p : ((ArrayPattern) pattern).getElements()) {
                check(p, element, scope);
            }
            return;
        }
        throw new IllegalStateException("unknown pattern " + pattern.getClass().getSimpleName());
    }

    private void checkStruct(StructPattern pattern, MxType expected, TypeEnvironment scope) {
        StructType struct = scope.lookupStruct(pattern.getStructName());
        if (struct == null) {
            throw TypeCheckException.unknownIdentifier(pattern.getStructName(), pattern.getLocation());
        }
        checker.unify(expected, struct, pattern.getLocation());
        for (FieldPattern field : pattern.getFields()) {
            MxType fieldType = struct.getFieldType(field.getName());
            if (fieldType == null) {
                throw TypeCheckException.unknownIdentifier(struct.getName() + "." + field.getName(),
                        field.getLocation());
            }
            check(field.getPattern(), fieldType, scope);
        }
    }
}
