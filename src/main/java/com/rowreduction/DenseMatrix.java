package com.rowreduction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A dense {@code rows × cols} matrix over any {@link Numeric} element type.
 * Entries live in one row-major list (index {@code r * cols + c}); the shape
 * is fixed once constructed, so operations that change shape return a new
 * matrix.  Rows and columns are indexed from zero and every accessor is
 * bounds-checked.
 */
public class DenseMatrix<T extends Numeric<T>> {
    private final int rows;
    private final int cols;
    private final List<T> data;

    /** Constructs a {@code rows × cols} matrix with every entry set to {@code fill}. */
    public DenseMatrix(int rows, int cols, T fill) {
        int size = checkShape(rows, cols);
        Objects.requireNonNull(fill, "fill");
        this.rows = rows;
        this.cols = cols;
        this.data = new ArrayList<>(Collections.nCopies(size, fill));
    }

    /** Constructs a matrix from {@code rows * cols} entries listed row by row. */
    public DenseMatrix(int rows, int cols, List<T> values) {
        int size = checkShape(rows, cols);
        Objects.requireNonNull(values, "values");
        if (values.size() != size) {
            throw new DimensionException(DimensionException.Reason.SIZE_MISMATCH,
                    "Expected " + size + " values for a " + rows + "x" + cols
                            + " matrix, got " + values.size());
        }
        this.rows = rows;
        this.cols = cols;
        this.data = new ArrayList<>(size);
        for (T v : values) data.add(Objects.requireNonNull(v, "null entry"));
    }

    /** Adopts {@code data} as storage; callers pass a fresh list of exactly rows * cols entries. */
    private DenseMatrix(List<T> data, int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /** Builds a matrix whose rows are the given lists. */
    public static <T extends Numeric<T>> DenseMatrix<T> fromRows(List<? extends List<T>> rowList) {
        int[] shape = checkNested(rowList, "row");
        List<T> flat = new ArrayList<>(checkShape(shape[0], shape[1]));
        for (List<T> row : rowList) flat.addAll(row);
        return new DenseMatrix<>(shape[0], shape[1], flat);
    }

    /** Builds a matrix whose columns are the given lists. */
    public static <T extends Numeric<T>> DenseMatrix<T> fromColumns(List<? extends List<T>> colList) {
        int[] shape = checkNested(colList, "column");
        int m = shape[1], n = shape[0];
        List<T> a = new ArrayList<>(checkShape(m, n));
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) a.add(Objects.requireNonNull(colList.get(j).get(i), "null entry"));
        }
        return new DenseMatrix<>(a, m, n);
    }

    /** The {@code n × n} identity, with identities taken from {@code sample}. */
    public static <T extends Numeric<T>> DenseMatrix<T> identity(int n, T sample) {
        DenseMatrix<T> id = new DenseMatrix<>(n, n, sample.zero());
        for (int i = 0; i < n; i++) id.data.set(i * n + i, sample.one());
        return id;
    }

    public int rows() { return rows; }
    public int cols() { return cols; }
    public boolean isSquare() { return rows == cols; }

    /** Returns the entry at row {@code r}, column {@code c}. */
    public T get(int r, int c) {
        checkIndex(r, c);
        return elementAt(r * cols + c);
    }

    /** Sets the entry at row {@code r}, column {@code c}. */
    public void set(int r, int c, T value) {
        checkIndex(r, c);
        data.set(r * cols + c, Objects.requireNonNull(value, "value"));
    }

    /**
     * Returns a live view of row {@code r}.  Writes through the view change
     * this matrix.  The view is meant for immediate use and should not be kept
     * once the caller is done with the matrix.
     */
    public RowView row(int r) {
        checkRow(r);
        return new RowView(r);
    }

    /** Copy of row {@code r}. */
    public List<T> rowValues(int r) {
        return row(r).toList();
    }

    /** Copy of column {@code c}. */
    public List<T> column(int c) {
        if (c < 0 || c >= cols) throw new IndexOutOfBoundsException("Column " + c + " outside 0.." + (cols - 1));
        List<T> out = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) out.add(elementAt(i * cols + c));
        return out;
    }

    /** Deep copy; the result shares no storage with this matrix. */
    public DenseMatrix<T> copy() {
        return new DenseMatrix<>(new ArrayList<>(data), rows, cols);
    }

    // ---- arithmetic ----

    public DenseMatrix<T> multiply(T scalar) {
        Objects.requireNonNull(scalar, "scalar");
        List<T> a = new ArrayList<>(data.size());
        for (T x : data) a.add(x.multiply(scalar));
        return new DenseMatrix<>(a, rows, cols);
    }

    public DenseMatrix<T> add(DenseMatrix<T> o) {
        if (rows != o.rows || cols != o.cols) {
            throw new DimensionException(DimensionException.Reason.SIZE_MISMATCH,
                    "Cannot add " + shape() + " and " + o.shape());
        }
        List<T> a = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) a.add(data.get(i).add(o.data.get(i)));
        return new DenseMatrix<>(a, rows, cols);
    }

    public DenseMatrix<T> multiply(DenseMatrix<T> o) {
        if (cols != o.rows) {
            throw new DimensionException(DimensionException.Reason.SIZE_MISMATCH,
                    "Cannot multiply " + shape() + " by " + o.shape());
        }
        List<T> a = new ArrayList<>(checkShape(rows, o.cols));
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < o.cols; j++) {
                T sum = data.get(i * cols).multiply(o.data.get(j));
                for (int k = 1; k < cols; k++) {
                    sum = sum.add(data.get(i * cols + k).multiply(o.data.get(k * o.cols + j)));
                }
                a.add(sum);
            }
        }
        return new DenseMatrix<>(a, rows, o.cols);
    }

    public DenseMatrix<T> transpose() {
        List<T> a = new ArrayList<>(data.size());
        for (int j = 0; j < cols; j++)
            for (int i = 0; i < rows; i++)
                a.add(data.get(i * cols + j));
        return new DenseMatrix<>(a, cols, rows);
    }

    /** Returns {@code [this | column]}. */
    public DenseMatrix<T> augment(List<T> column) {
        if (column.size() != rows) {
            throw new DimensionException(DimensionException.Reason.SIZE_MISMATCH,
                    "Augmented column has " + column.size() + " entries, matrix has " + rows + " rows");
        }
        return augment(new DenseMatrix<>(rows, 1, column));
    }

    /** Returns {@code [this | right]}. */
    public DenseMatrix<T> augment(DenseMatrix<T> right) {
        if (right.rows != rows) {
            throw new DimensionException(DimensionException.Reason.SIZE_MISMATCH,
                    "Cannot augment " + shape() + " with " + right.shape());
        }
        int n = cols + right.cols;
        List<T> a = new ArrayList<>(checkShape(rows, n));
        for (int i = 0; i < rows; i++) {
            a.addAll(data.subList(i * cols, (i + 1) * cols));
            a.addAll(right.data.subList(i * right.cols, (i + 1) * right.cols));
        }
        return new DenseMatrix<>(a, rows, n);
    }

    /** Columns {@code c0} (inclusive) to {@code c1} (exclusive) as a new matrix. */
    public DenseMatrix<T> columns(int c0, int c1) {
        if (c0 < 0 || c1 > cols || c0 >= c1) {
            throw new IndexOutOfBoundsException("Column range [" + c0 + ", " + c1 + ") outside 0.." + cols);
        }
        List<T> a = new ArrayList<>(rows * (c1 - c0));
        for (int i = 0; i < rows; i++) a.addAll(data.subList(i * cols + c0, i * cols + c1));
        return new DenseMatrix<>(a, rows, c1 - c0);
    }

    // ---- elimination-backed queries ----

    public DenseMatrix<T> rref() { return RowReducer.reduce(this).matrix(); }
    public T det() { return LinearAlgebra.determinant(this); }
    public int rank() { return LinearAlgebra.rank(this); }
    public boolean linearlyIndependent() { return LinearAlgebra.linearlyIndependent(this); }
    public Solution<T> solve(List<T> b) { return LinearAlgebra.solve(this, b); }
    public DenseMatrix<T> inverse() { return LinearAlgebra.inverse(this); }

    // ---- Object ----

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DenseMatrix)) return false;
        DenseMatrix<?> o = (DenseMatrix<?>) obj;
        return rows == o.rows && cols == o.cols && data.equals(o.data);
    }

    @Override public int hashCode() {
        return (rows * 31 + cols) * 31 + data.hashCode();
    }

    /** Rows on separate lines, entries separated by ", ". */
    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows; i++) {
            if (i > 0) sb.append('\n');
            for (int j = 0; j < cols; j++) {
                if (j > 0) sb.append(", ");
                sb.append(data.get(i * cols + j));
            }
        }
        return sb.toString();
    }

    String shape() { return rows + "x" + cols; }

    // ---- package-private storage access for RowOperations ----

    T elementAt(int index) { return data.get(index); }

    void setElementAt(int index, T value) { data.set(index, value); }

    void checkRow(int r) {
        if (r < 0 || r >= rows) throw new IndexOutOfBoundsException("Row " + r + " outside 0.." + (rows - 1));
    }

    private void checkIndex(int r, int c) {
        if (r < 0 || r >= rows || c < 0 || c >= cols) {
            throw new IndexOutOfBoundsException("Element (" + r + ", " + c + ") outside " + shape() + " matrix");
        }
    }

    /** Validates the shape and returns the element count. */
    private static int checkShape(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new DimensionException(DimensionException.Reason.INVALID_DIMENSION,
                    "Matrix dimensions must be positive, got " + rows + "x" + cols);
        }
        try {
            return Math.multiplyExact(rows, cols);
        } catch (ArithmeticException e) {
            throw new DimensionException(DimensionException.Reason.INVALID_DIMENSION,
                    "Matrix of " + rows + "x" + cols + " entries exceeds the maximum size");
        }
    }

    /** Returns {outer, inner} after validating a nested initializer. */
    private static <T> int[] checkNested(List<? extends List<T>> lists, String what) {
        Objects.requireNonNull(lists, what + "s");
        if (lists.isEmpty()) {
            throw new DimensionException(DimensionException.Reason.INVALID_DIMENSION, "No " + what + "s given");
        }
        int len = lists.get(0).size();
        for (int k = 0; k < lists.size(); k++) {
            int size = lists.get(k).size();
            if (size == 0) {
                throw new DimensionException(DimensionException.Reason.INVALID_DIMENSION,
                        "Empty " + what + " at index " + k);
            }
            if (size != len) {
                throw new DimensionException(DimensionException.Reason.RAGGED_INPUT,
                        what + " " + k + " has " + size + " entries, expected " + len);
            }
        }
        return new int[] { lists.size(), len };
    }

    /** Live, non-owning view of one row. */
    public final class RowView {
        private final int r;
        private RowView(int r) { this.r = r; }
        public int index() { return r; }
        public int length() { return cols; }
        public T get(int j) { return DenseMatrix.this.get(r, j); }
        public void set(int j, T v) { DenseMatrix.this.set(r, j, v); }
        public List<T> toList() {
            List<T> a = new ArrayList<>(cols);
            for (int j = 0; j < cols; j++) a.add(elementAt(r * cols + j));
            return Collections.unmodifiableList(a);
        }
    }
}
