package com.rowreduction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Determinant, rank, independence, solve and inverse, all read off {@link RowReducer} output. */
public final class LinearAlgebra {

    private LinearAlgebra() {}

    /**
     * det(A) = (product of the reduced diagonal) * (product of the divided-out
     * pivots) * (-1)^swaps.  The reduced diagonal is all ones for a nonsingular
     * matrix and contains a zero otherwise.
     */
    public static <T extends Numeric<T>> T determinant(DenseMatrix<T> a) {
        requireSquare(a, "Determinant");
        if (a.rows() == 1) return a.get(0, 0);

        RrefResult<T> rr = RowReducer.reduce(a);
        DenseMatrix<T> reduced = rr.matrix();
        T det = reduced.get(0, 0);
        for (int i = 1; i < reduced.rows(); i++) det = det.multiply(reduced.get(i, i));
        det = det.multiply(rr.pivotProduct());
        return (rr.swaps() % 2 == 1) ? det.negate() : det;
    }

    public static <T extends Numeric<T>> int rank(DenseMatrix<T> a) {
        return RowReducer.reduce(a).rank();
    }

    /** True iff the columns of {@code a} are linearly independent (every column holds a pivot). */
    public static <T extends Numeric<T>> boolean linearlyIndependent(DenseMatrix<T> a) {
        return rank(a) == a.cols();
    }

    /** Solves {@code a x = b} for square {@code a}. */
    public static <T extends Numeric<T>> Solution<T> solve(DenseMatrix<T> a, List<T> b) {
        Objects.requireNonNull(b, "b");
        if (b.size() != a.rows()) {
            throw new DimensionException(DimensionException.Reason.SIZE_MISMATCH,
                    "Right-hand side has " + b.size() + " entries, matrix has " + a.rows() + " rows");
        }
        requireSquare(a, "Solve");

        int n = a.cols();
        RrefResult<T> rr = RowReducer.reduce(a.augment(b), n);
        DenseMatrix<T> reduced = rr.matrix();

        if (rr.rank() == n) {
            List<T> x = new ArrayList<>(n);
            for (int i = 0; i < n; i++) x.add(reduced.get(i, n));
            return Solution.unique(x);
        }
        // rows past the rank are zero in the coefficient block
        for (int i = rr.rank(); i < reduced.rows(); i++) {
            if (!reduced.get(i, n).isZero()) return Solution.none(Solution.Status.INCONSISTENT);
        }
        return Solution.none(Solution.Status.INFINITE);
    }

    /** Inverse via reduction of {@code [A | I]}. */
    public static <T extends Numeric<T>> DenseMatrix<T> inverse(DenseMatrix<T> a) {
        requireSquare(a, "Inverse");
        int n = a.rows();
        RrefResult<T> rr = RowReducer.reduce(a.augment(DenseMatrix.identity(n, a.get(0, 0))), n);
        if (rr.rank() < n) throw new ArithmeticException("Singular matrix has no inverse");
        return rr.matrix().columns(n, 2 * n);
    }

    private static void requireSquare(DenseMatrix<?> a, String op) {
        if (!a.isSquare()) {
            throw new DimensionException(DimensionException.Reason.NOT_SQUARE,
                    op + " needs a square matrix, got " + a.shape());
        }
    }
}
