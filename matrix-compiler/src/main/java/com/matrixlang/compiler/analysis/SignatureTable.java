package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.analysis.types.TypeScheme;

import java.util.Collection;
import java.util.Collections;

/**
 * 内置函数签名表：类型检查器通过它查找内置名字的类型方案
 */
public interface SignatureTable {

    /** 查找内置名字的方案；未注册返回 null */
    TypeScheme lookupSignature(String name);

    /** 所有已注册的内置名字 */
    Collection<String> signatureNames();

    SignatureTable EMPTY = new SignatureTable() {
        @Override
        public TypeScheme lookupSignature(String name) {
            return null;
        }

        @Override
        public Collection<String> signatureNames() {
            return Collections.emptyList();
        }
    };
}
