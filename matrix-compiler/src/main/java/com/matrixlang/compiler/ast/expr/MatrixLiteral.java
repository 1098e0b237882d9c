package com.matrixlang.compiler.ast.expr;

import com.matrixlang.compiler.ast.AstVisitor;
import com.matrixlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 矩阵候选字面量：{@code [[a, b], [c, d]]}，各行均为等长数组字面量。
 *
 * <p>是 Matrix 还是 Array&lt;Array&lt;T&gt;&gt; 由类型检查器根据元素类型决定：
 * 元素类型为 Int 或 Float 时为矩阵，否则为嵌套数组。</p>
 */
public final class MatrixLiteral extends Expression {
    private final List<List<Expression>> rows;

    public MatrixLiteral(SourceLocation location, List<List<Expression>> rows) {
        super(location);
        this.rows = rows;
    }

    public List<List<Expression>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return rows.isEmpty() ? 0 : rows.get(0).size();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMatrixLiteral(this, context);
    }
}
