package com.matrixlang.compiler.analysis;

import com.matrixlang.compiler.ast.expr.MatrixLiteral;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * 检查器对 AST 节点作出的、求值器需要遵循的决定（按节点身份索引）
 */
public final class TypeAnnotations {

    private final Map<MatrixLiteral, Boolean> matrixDecisions = new IdentityHashMap<MatrixLiteral, Boolean>();

    void recordMatrixDecision(MatrixLiteral literal, boolean isMatrix) {
        matrixDecisions.put(literal, isMatrix);
    }

    /**
     * 矩阵候选字面量是否按 Matrix 求值；未经检查的节点返回 null
     */
    public Boolean isMatrix(MatrixLiteral literal) {
        return matrixDecisions.get(literal);
    }

    /** 合并另一次检查的决定（REPL 中逐条累积） */
    public void mergeFrom(TypeAnnotations other) {
        matrixDecisions.putAll(other.matrixDecisions);
    }
}
