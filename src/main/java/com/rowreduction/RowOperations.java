package com.rowreduction;

import java.util.Objects;

/**
 * The three elementary row operations, applied in place.  Indices are checked
 * before anything is written, so a rejected call leaves the matrix unchanged.
 */
public final class RowOperations {

    private RowOperations() {}

    public static <T extends Numeric<T>> void swapRows(DenseMatrix<T> m, int r1, int r2) {
        m.checkRow(r1);
        m.checkRow(r2);
        if (r1 == r2) return;
        int n = m.cols();
        int a = r1 * n, b = r2 * n;
        for (int j = 0; j < n; j++) {
            T tmp = m.elementAt(a + j);
            m.setElementAt(a + j, m.elementAt(b + j));
            m.setElementAt(b + j, tmp);
        }
    }

    /** row[r] *= scalar */
    public static <T extends Numeric<T>> void scaleRow(DenseMatrix<T> m, int r, T scalar) {
        m.checkRow(r);
        Objects.requireNonNull(scalar, "scalar");
        int n = m.cols(), base = r * n;
        for (int j = 0; j < n; j++) m.setElementAt(base + j, m.elementAt(base + j).multiply(scalar));
    }

    /** row[target] += scalar * row[source] */
    public static <T extends Numeric<T>> void addRow(DenseMatrix<T> m, int source, int target, T scalar) {
        m.checkRow(source);
        m.checkRow(target);
        Objects.requireNonNull(scalar, "scalar");
        int n = m.cols(), s = source * n, t = target * n;
        for (int j = 0; j < n; j++) {
            T x = m.elementAt(s + j);
            if (x.isZero()) continue;
            m.setElementAt(t + j, m.elementAt(t + j).add(scalar.multiply(x)));
        }
    }
}
