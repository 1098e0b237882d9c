package matrix.runtime.interpreter;

import com.matrixlang.compiler.ast.pattern.*;
import matrix.runtime.MxArray;
import matrix.runtime.MxStruct;
import matrix.runtime.MxValue;

import java.util.List;

/**
 * match 模式匹配：成功时把模式变量定义到 scope 中
 */
final class PatternMatcher {

    private PatternMatcher() {}

    static boolean matches(Pattern pattern, MxValue value, Environment scope) {
        if (pattern instanceof WildcardPattern) {
            return true;
        }
        if (pattern instanceof BindingPattern) {
            scope.define(((BindingPattern) pattern).getName(), value, false);
            return true;
        }
        if (pattern instanceof LiteralPattern) {
            MxValue expected = Interpreter.literalValue(((LiteralPattern) pattern).getLiteral());
            return expected.getTypeName().equals(value.getTypeName()) && BinaryOps.valueEquals(expected, value);
        }
        if (pattern instanceof StructPattern) {
            StructPattern sp = (StructPattern) pattern;
            if (!(value instanceof MxStruct) || !((MxStruct) value).getName().equals(sp.getStructName())) {
                return false;
            }
            MxStruct struct = (MxStruct) value;
            for (FieldPattern field : sp.getFields()) {
                MxValue fieldValue = struct.getField(field.getName());
                if (fieldValue == null || !matches(field.getPattern(), fieldValue, scope)) {
                    return false;
                }
            }
            return true;
        }
        if (pattern instanceof ArrayPattern) {
            List<Pattern> elements = ((ArrayPattern) pattern).getElements();
            if (!value.isArray()) return false;
            MxArray array = value.asArray();
            if (array.size() != elements.size()) return false;
            for (int i = 0; i < elements.size(); i++) {
                if (!matches(elements.get(i), array.get(i), scope)) return false;
            }
            return true;
        }
        throw new IllegalStateException("unknown pattern " + pattern.getClass().getSimpleName());
    }
}
