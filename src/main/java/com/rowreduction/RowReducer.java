package com.rowreduction;

import java.util.Arrays;

/**
 * Gauss-Jordan elimination to reduced row echelon form.
 *
 * <p>Pivoting takes the first nonzero entry at or below the current row, with
 * no magnitude comparison.  That is exact for {@link Fraction}; for
 * {@link Real} it is plain Gaussian elimination without partial pivoting.
 * The input matrix is never modified.
 */
public final class RowReducer {

    private RowReducer() {}

    public static <T extends Numeric<T>> RrefResult<T> reduce(DenseMatrix<T> input) {
        return reduce(input, input.cols());
    }

    /**
     * Reduces {@code input}, choosing pivots only among its first
     * {@code pivotCols} columns.  The remaining columns (e.g. the right-hand
     * side of an augmented system) are transformed but never pivoted on.
     */
    public static <T extends Numeric<T>> RrefResult<T> reduce(DenseMatrix<T> input, int pivotCols) {
        if (pivotCols < 0 || pivotCols > input.cols()) {
            throw new IndexOutOfBoundsException("Pivot column limit " + pivotCols + " outside 0.." + input.cols());
        }
        DenseMatrix<T> work = input.copy();
        int m = work.rows();
        T one = work.get(0, 0).one();

        T pivotProduct = one;
        int swaps = 0;
        int[] pivots = new int[Math.min(m, pivotCols)];
        int rank = 0;

        int r = 0, c = 0;
        while (r < m && c < pivotCols) {
            int p = firstNonzero(work, c, r);
            if (p < 0) { c++; continue; }

            if (p != r) {
                RowOperations.swapRows(work, p, r);
                swaps++;
            }

            T piv = work.get(r, c);
            if (!piv.isOne()) {
                RowOperations.scaleRow(work, r, one.divide(piv));
                pivotProduct = pivotProduct.multiply(piv);
                work.set(r, c, one);   // exact even when division rounds
            }

            for (int i = 0; i < m; i++) {
                if (i == r) continue;
                T f = work.get(i, c);
                if (f.isZero()) continue;
                RowOperations.addRow(work, r, i, f.negate());
                work.set(i, c, one.zero());
            }

            pivots[rank++] = c;
            r++;
            c++;
        }
        return new RrefResult<>(work, swaps, pivotProduct, Arrays.copyOf(pivots, rank));
    }

    private static <T extends Numeric<T>> int firstNonzero(DenseMatrix<T> work, int col, int fromRow) {
        for (int i = fromRow; i < work.rows(); i++) if (!work.get(i, col).isZero()) return i;
        return -1;
    }
}
