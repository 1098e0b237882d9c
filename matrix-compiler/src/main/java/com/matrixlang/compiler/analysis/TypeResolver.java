package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.*;
import com.matrixlang.compiler.ast.type.ArrayTypeRef;
import com.matrixlang.compiler.ast.type.FunctionTypeRef;
import com.matrixlang.compiler.ast.type.SimpleType;
import com.matrixlang.compiler.ast.type.TypeRef;
import com.matrixlang.compiler.ast.type.TypeRefVisitor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 类型注解 (TypeRef) → MxType
 *
 * <p>小写单名是类型变量，同一个解析器实例内同名变量解析为同一个 {@link TypeVariable}；
 * 命名参数（如类型类的 T）通过 {@link #bindName} 预先绑定。</p>
 */
public final class TypeResolver implements TypeRefVisitor<MxType> {

    private final TypeEnvironment env;
    private final TypeUnifier unifier;
    private final Map<String, MxType> named = new LinkedHashMap<String, MxType>();

    public TypeResolver(TypeEnvironment env, TypeUnifier unifier) {
        this.env = env;
        this.unifier = unifier;
    }

    public void bindName(String name, MxType type) {
        named.put(name, type);
    }

    /** 本解析器已引入的类型变量名 */
    public Map<String, MxType> getNamedTypes() {
        return named;
    }

    public MxType resolve(TypeRef ref) {
        return ref.accept(this);
    }

    @Override
    public MxType visitSimple(SimpleType type) {
        String name = type.getName();
        MxType bound = named.get(name);
        if (bound != null && type.getTypeArgs().isEmpty()) return bound;

        if (type.isTypeVariable()) {
            TypeVariable var = unifier.fresh();
            named.put(name, var);
            return var;
        }

        PrimitiveType primitive = PrimitiveType.byName(name);
        if (primitive != null) {
            expectArgs(type, 0);
            return primitive;
        }
        if ("Array".equals(name)) {
            expectArgs(type, 1);
            return new ArrayType(resolve(type.getTypeArgs().get(0)));
        }
        if ("Matrix".equals(name)) {
            expectArgs(type, 1);
            MxType element = resolve(type.getTypeArgs().get(0));
            unifier.constrain(element, TypeConstraint.NUM, type.getLocation());
            return new MatrixType(element);
        }
        int opaqueArity = OpaqueType.arityOf(name);
        if (opaqueArity >= 0) {
            expectArgs(type, opaqueArity);
            List<MxType> args = new ArrayList<MxType>();
            for (TypeRef arg : type.getTypeArgs()) {
                args.add(resolve(arg));
            }
            return new OpaqueType(name, args);
        }
        StructType struct = env.lookupStruct(name);
        if (struct != null) {
            expectArgs(type, 0);
            return struct;
        }
        throw TypeCheckException.unknownIdentifier(name, type.getLocation());
    }

    @Override
    public MxType visitArray(ArrayTypeRef type) {
        return new ArrayType(resolve(type.getElementType()));
    }

    @Override
    public MxType visitFunction(FunctionTypeRef type) {
        List<MxType> params = new ArrayList<MxType>();
        for (TypeRef p : type.getParamTypes()) {
            params.add(resolve(p));
        }
        return new FunctionType(params, resolve(type.getReturnType()));
    }

    private static void expectArgs(SimpleType type, int count) {
        if (type.getTypeArgs().size() != count) {
            throw TypeCheckException.arity("type " + type.getName() + " expects " + count
                    + " type argument(s), found " + type.getTypeArgs().size(), type.getLocation());
        }
    }
}
