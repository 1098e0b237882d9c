package matrix.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 矩阵值：行优先存储，元素全为 Int 或全为 Float
 */
public final class MxMatrix extends MxValue {

    private final int rows;
    private final int cols;
    private final MxValue[] cells;

    public MxMatrix(int rows, int cols, MxValue[] cells) {
        if (rows <= 0 || cols <= 0 || cells.length != rows * cols) {
            throw new IllegalArgumentException("invalid matrix shape " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.cells = cells.clone();
    }

    /**
     * 从等长的行构造
     */
    public static MxMatrix fromRows(List<List<MxValue>> rowValues) {
        int rows = rowValues.size();
        int cols = rows == 0 ? 0 : rowValues.get(0).size();
        MxValue[] cells = new MxValue[rows * cols];
        for (int r = 0; r < rows; r++) {
            List<MxValue> row = rowValues.get(r);
            if (row.size() != cols) {
                throw new MxRuntimeException(RuntimeErrorKind.ArgumentMismatch,
                        "matrix rows must have equal length: expected " + cols + ", got " + row.size(),
                        null, "Matrix");
            }
            for (int c = 0; c < cols; c++) {
                cells[r * cols + c] = row.get(c);
            }
        }
        return new MxMatrix(rows, cols, cells);
    }

    public static MxMatrix ofDoubles(double[][] data) {
        int rows = data.length;
        int cols = data[0].length;
        MxValue[] cells = new MxValue[rows * cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                cells[r * cols + c] = MxFloat.of(data[r][c]);
            }
        }
        return new MxMatrix(rows, cols, cells);
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public MxValue get(int row, int col) {
        return cells[row * cols + col];
    }

    /** 第 row 行作为数组 */
    public MxArray row(int row) {
        return new MxArray(Arrays.asList(cells).subList(row * cols, (row + 1) * cols));
    }

    /** 元素是否为 Int */
    public boolean isIntegral() {
        return cells[0].isInt();
    }

    public double[][] toDoubles() {
        double[][] result = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                result[r][c] = get(r, c).asNumber();
            }
        }
        return result;
    }

    @Override
    public String getTypeName() {
        return "Matrix";
    }

    @Override
    public Object toJavaValue() {
        List<Object> result = new ArrayList<Object>(rows);
        for (int r = 0; r < rows; r++) {
            result.add(row(r).toJavaValue());
        }
        return result;
    }

    @Override
    public boolean isMatrix() {
        return true;
    }

    @Override
    public MxMatrix asMatrix() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MxMatrix)) return false;
        MxMatrix other = (MxMatrix) o;
        return other.rows == rows && other.cols == cols && Arrays.equals(other.cells, cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int r = 0; r < rows; r++) {
            if (r > 0) sb.append(", ");
            sb.append(row(r));
        }
        return sb.append(']').toString();
    }
}
