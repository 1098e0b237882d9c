package matrix.runtime.interpreter.builtin;

import com.matrixlang.compiler.analysis.types.*;
import matrix.runtime.MxHandle;
import matrix.runtime.MxRuntimeException;
import matrix.runtime.MxStruct;
import matrix.runtime.MxValue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 调用内置函数前按方案核对实参的个数与形状
 *
 * <p>类型检查通过的程序不会触发这里的错误；它挡住的是绕过检查器的调用
 * （如宿主代码直接调用）。只看最外层形状，不深入数组元素。</p>
 */
final class ArgumentGuard {

    private ArgumentGuard() {}

    static void check(String name, TypeScheme scheme, List<MxValue> args) {
        MxType body = scheme.getBody();
        if (!(body instanceof FunctionType)) return;
        List<MxType> params = ((FunctionType) body).getParamTypes();
        if (params.size() != args.size()) {
            throw MxRuntimeException.argumentMismatch(name, params.size() + " argument(s)",
                    String.valueOf(args.size()), null);
        }
        // 同一类型变量的实参必须是同一种值
        Map<Integer, String> seen = new HashMap<Integer, String>();
        for (int i = 0; i < params.size(); i++) {
            MxType param = params.get(i);
            MxValue arg = args.get(i);
            if (param instanceof TypeVariable) {
                int id = ((TypeVariable) param).getId();
                checkConstraint(name, scheme.getConstraint(id), arg, i);
                String previous = seen.put(id, arg.getTypeName());
                if (previous != null && !previous.equals(arg.getTypeName())) {
                    throw MxRuntimeException.argumentMismatch(name,
                            previous + " for argument " + (i + 1), arg.getTypeName(), null);
                }
            } else if (!matches(param, arg)) {
                throw MxRuntimeException.argumentMismatch(name,
                        param.toDisplayString() + " for argument " + (i + 1), arg.getTypeName(), null);
            }
        }
    }

    private static void checkConstraint(String name, TypeConstraint constraint, MxValue arg, int index) {
        if (constraint.isNone()) return;
        TypeShape shape = shapeOf(arg);
        if (!constraint.allowsShape(shape)) {
            throw MxRuntimeException.argumentMismatch(name,
                    constraint.describeShapes() + " for argument " + (index + 1), arg.getTypeName(), null);
        }
    }

    private static TypeShape shapeOf(MxValue value) {
        if (value.isInt()) return TypeShape.INT;
        if (value.isFloat()) return TypeShape.FLOAT;
        if (value.isString()) return TypeShape.STRING;
        if (value.isMatrix()) return TypeShape.MATRIX;
        return null;
    }

    static boolean matches(MxType type, MxValue value) {
        if (type instanceof PrimitiveType) {
            return ((PrimitiveType) type).getName().equals(value.getTypeName());
        }
        if (type instanceof ArrayType) return value.isArray();
        if (type instanceof MatrixType) return value.isMatrix();
        if (type instanceof FunctionType) return value.isCallable();
        if (type instanceof OpaqueType) {
            return value instanceof MxHandle && ((MxHandle) value).getKind().equals(((OpaqueType) type).getName());
        }
        if (type instanceof StructType) {
            return value instanceof MxStruct && ((MxStruct) value).getName().equals(((StructType) type).getName());
        }
        return true;
    }
}
