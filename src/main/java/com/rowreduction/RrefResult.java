package com.rowreduction;

import java.util.Arrays;

/**
 * A reduced row echelon form together with the bookkeeping needed to recover
 * the determinant of the matrix it came from.
 */
public final class RrefResult<T extends Numeric<T>> {
    private final DenseMatrix<T> matrix;
    private final int swaps;
    private final T pivotProduct;
    private final int[] pivotColumns;

    RrefResult(DenseMatrix<T> matrix, int swaps, T pivotProduct, int[] pivotColumns) {
        this.matrix = matrix;
        this.swaps = swaps;
        this.pivotProduct = pivotProduct;
        this.pivotColumns = pivotColumns;
    }

    public DenseMatrix<T> matrix() { return matrix; }

    /** Number of row exchanges performed. */
    public int swaps() { return swaps; }

    /** Product of every pivot value a row was divided by. */
    public T pivotProduct() { return pivotProduct; }

    /** Pivot column of row i, for i in 0..rank-1; strictly increasing. */
    public int[] pivotColumns() { return Arrays.copyOf(pivotColumns, pivotColumns.length); }

    public int rank() { return pivotColumns.length; }

    @Override
    public String toString() {
        return "*rank=" + rank() + " swaps=" + swaps + " pivot_product=" + pivotProduct;
    }
}
