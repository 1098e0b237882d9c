package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.MxType;
import com.matrixlang.compiler.analysis.types.TypeConstraint;
import com.matrixlang.compiler.analysis.types.TypeScheme;
import com.matrixlang.compiler.analysis.types.TypeVariable;
import com.matrixlang.compiler.parser.Parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析内置函数签名文本，如 {@code "Num a => (a) -> a"} 或 {@code "(Float) -> Float"}
 *
 * <p>签名中的所有类型变量都被量化。约束前缀中的名字按 {@link TypeConstraint#named} 解析。</p>
 */
public final class SchemeParser {

    private SchemeParser() {
    }

    public static TypeScheme parse(String signature) {
        String constraintText = "";
        String bodyText = signature;
        int arrow = signature.indexOf("=>");
        if (arrow >= 0) {
            constraintText = signature.substring(0, arrow).trim();
            bodyText = signature.substring(arrow + 2);
        }

        // 方案内部的变量 id 独立编号；实例化时总会被替换为新变量
        TypeUnifier local = new TypeUnifier();
        TypeResolver resolver = new TypeResolver(new TypeEnvironment(SignatureTable.EMPTY), local);
        MxType body = resolver.resolve(new Parser(bodyText, "<signature>").parseStandaloneType());

        Map<String, TypeConstraint> declared = parseConstraints(constraintText, signature);
        List<TypeVariable> quantified = new ArrayList<TypeVariable>();
        Map<Integer, TypeConstraint> constraints = new LinkedHashMap<Integer, TypeConstraint>();
        for (Map.Entry<String, MxType> e : resolver.getNamedTypes().entrySet()) {
            if (!(e.getValue() instanceof TypeVariable)) continue;
            TypeVariable var = (TypeVariable) e.getValue();
            quantified.add(var);
            TypeConstraint c = local.constraintOf(var);
            TypeConstraint extra = declared.remove(e.getKey());
            if (extra != null) c = c.merge(extra);
            if (!c.isNone()) constraints.put(var.getId(), c);
        }
        if (!declared.isEmpty()) {
            throw new IllegalArgumentException("constraint on unused type variable "
                    + declared.keySet() + " in signature: " + signature);
        }
        return new TypeScheme(quantified, constraints, body);
    }

    private static Map<String, TypeConstraint> parseConstraints(String text, String signature) {
        Map<String, TypeConstraint> result = new LinkedHashMap<String, TypeConstraint>();
        if (text.isEmpty()) return result;
        for (String part : text.split(",")) {
            String[] words = part.trim().split("\\s+");
            if (words.length != 2) {
                throw new IllegalArgumentException("malformed constraint '" + part.trim()
                        + "' in signature: " + signature);
            }
            TypeConstraint c = TypeConstraint.named(words[0]);
            TypeConstraint existing = result.get(words[1]);
            result.put(words[1], existing != null ? existing.merge(c) : c);
        }
        return result;
    }
}
