package matrix.runtime.interpreter.builtin;

import matrix.runtime.MxFloat;
import matrix.runtime.MxInt;
import matrix.runtime.MxMatrix;
import matrix.runtime.MxValue;

import java.util.ArrayList;
import java.util.List;

/**
 * 矩阵函数
 */
public final class StdlibMatrix {

    private StdlibMatrix() {}

    public static void register(BuiltinRegistry registry) {
        registry.register("transpose", "(Matrix<a>) -> Matrix<a>", NativeFunction.create(m -> {
            MxMatrix matrix = m.asMatrix();
            int rows = matrix.getRows();
            int cols = matrix.getCols();
            MxValue[] cells = new MxValue[rows * cols];
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    cells[c * rows + r] = matrix.get(r, c);
                }
            }
            return new MxMatrix(cols, rows, cells);
        }));

        registry.register("matrix_rows", "(Matrix<a>) -> Int", NativeFunction.create(m ->
                MxInt.of(m.asMatrix().getRows())));
        registry.register("matrix_cols", "(Matrix<a>) -> Int", NativeFunction.create(m ->
                MxInt.of(m.asMatrix().getCols())));

        registry.register("identity", "(Int) -> Matrix<Float>", NativeFunction.create(n -> {
            long size = n.asInt();
            if (size <= 0 || size > 4096) {
                throw new IllegalArgumentException("identity size must be between 1 and 4096, got " + size);
            }
            double[][] data = new double[(int) size][(int) size];
            for (int i = 0; i < size; i++) data[i][i] = 1.0;
            return MxMatrix.ofDoubles(data);
        }));

        registry.register("determinant", "(Matrix<a>) -> Float", NativeFunction.create(m ->
                MxFloat.of(determinant(m.asMatrix()))));

        registry.register("to_matrix", "([[a]]) -> Matrix<a>", NativeFunction.create(rows -> {
            List<MxValue> outer = rows.asArray().getElements();
            if (outer.isEmpty() || outer.get(0).asArray().size() == 0) {
                throw new IllegalArgumentException("a matrix needs at least one row and one column");
            }
            List<List<MxValue>> rowValues = new ArrayList<List<MxValue>>();
            for (MxValue row : outer) {
                rowValues.add(row.asArray().getElements());
            }
            return MxMatrix.fromRows(rowValues);
        }));
    }

    /**
     * 部分主元高斯消元
     */
    static double determinant(MxMatrix matrix) {
        int n = matrix.getRows();
        if (n != matrix.getCols()) {
            throw new IllegalArgumentException("determinant needs a square matrix, got "
                    + n + "x" + matrix.getCols());
        }
        double[][] a = matrix.toDoubles();
        double det = 1.0;
        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int r = col + 1; r < n; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) pivot = r;
            }
            if (a[pivot][col] == 0.0) return 0.0;
            if (pivot != col) {
                double[] tmp = a[pivot];
                a[pivot] = a[col];
                a[col] = tmp;
                det = -det;
            }
            det *= a[col][col];
            for (int r = col + 1; r < n; r++) {
                double factor = a[r][col] / a[col][col];
                for (int c = col; c < n; c++) {
                    a[r][c] -= factor * a[col][c];
                }
            }
        }
        return det;
    }
}
