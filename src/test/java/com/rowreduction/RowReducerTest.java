package com.rowreduction;

import static com.rowreduction.DenseMatrixTest.of;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

/** Tests for RREF computation and its swap / pivot bookkeeping. */
public class RowReducerTest {

    @Test
    public void identityIsAlreadyReduced() {
        for (int n = 1; n <= 5; n++) {
            DenseMatrix<Fraction> id = DenseMatrix.identity(n, Fraction.ONE);
            RrefResult<Fraction> rr = RowReducer.reduce(id);
            assertEquals(id, rr.matrix());
            assertEquals(0, rr.swaps());
            assertEquals(Fraction.ONE, rr.pivotProduct());
            assertEquals(n, rr.rank());
        }
    }

    @Test
    public void reducesThreeByFourSystem() {
        DenseMatrix<Fraction> a = of(new long[][] { {1, -2, 1, 0}, {0, 2, -8, 8}, {5, 0, -5, 10} });
        assertEquals(of(new long[][] { {1, 0, 0, 1}, {0, 1, 0, 0}, {0, 0, 1, -1} }), a.rref());
    }

    @Test
    public void inputIsNotModified() {
        DenseMatrix<Fraction> a = of(new long[][] { {0, 2}, {3, 4} });
        DenseMatrix<Fraction> before = a.copy();
        RowReducer.reduce(a);
        assertEquals(before, a);
    }

    @Test
    public void tracksSwapsAndPivotProduct() {
        // column 0 pivot found in row 1 -> one swap; pivots 3 then 2
        RrefResult<Fraction> rr = RowReducer.reduce(of(new long[][] { {0, 2}, {3, 4} }));
        assertEquals(1, rr.swaps());
        assertEquals(Fraction.of(6), rr.pivotProduct());
        assertEquals(DenseMatrix.identity(2, Fraction.ONE), rr.matrix());

        // unit pivots contribute nothing to the product
        rr = RowReducer.reduce(of(new long[][] { {1, 2}, {3, 4} }));
        assertEquals(0, rr.swaps());
        assertEquals(Fraction.of(-2), rr.pivotProduct());
    }

    @Test
    public void rankDeficientColumnsAreSkipped() {
        DenseMatrix<Fraction> a = of(new long[][] { {0, 1, 2, 3}, {0, 2, 4, 7}, {0, 0, 0, 0} });
        RrefResult<Fraction> rr = RowReducer.reduce(a);
        assertEquals(of(new long[][] { {0, 1, 2, 0}, {0, 0, 0, 1}, {0, 0, 0, 0} }), rr.matrix());
        assertArrayEquals(new int[] {1, 3}, rr.pivotColumns());
        assertEquals(2, rr.rank());
    }

    @Test
    public void resultIsInReducedEchelonForm() {
        DenseMatrix<Fraction> a = DenseMatrixTest.fromArrays(new Fraction[][] {
                { Fraction.of(2), Fraction.of(4), Fraction.of(-2), Fraction.of(1, 2) },
                { Fraction.of(1), Fraction.of(2), Fraction.of(3), Fraction.of(-1) },
                { Fraction.of(3), Fraction.of(6), Fraction.of(1), Fraction.of(-1, 3) },
                { Fraction.of(0), Fraction.of(0), Fraction.of(5, 2), Fraction.of(7) } });
        RrefResult<Fraction> rr = RowReducer.reduce(a);
        DenseMatrix<Fraction> R = rr.matrix();
        int[] pivots = rr.pivotColumns();

        int prev = -1;
        for (int i = 0; i < pivots.length; i++) {
            int c = pivots[i];
            assertTrue(c > prev, "pivot columns strictly increase");
            prev = c;
            assertEquals(Fraction.ONE, R.get(i, c));
            for (int k = 0; k < c; k++) assertEquals(Fraction.ZERO, R.get(i, k), "pivot is leading entry");
            for (int r = 0; r < R.rows(); r++) if (r != i) assertEquals(Fraction.ZERO, R.get(r, c));
        }
        for (int i = pivots.length; i < R.rows(); i++)
            for (int j = 0; j < R.cols(); j++)
                assertEquals(Fraction.ZERO, R.get(i, j), "zero rows last");
    }

    @Test
    public void pivotColumnLimitKeepsTrailingColumnsOutOfPivots() {
        // [1 2 | 1]
        // [2 4 | 3]  -> inconsistent: trailing column must not become a pivot
        DenseMatrix<Fraction> ab = of(new long[][] { {1, 2, 1}, {2, 4, 3} });
        assertArrayEquals(new int[] {0}, RowReducer.reduce(ab, 2).pivotColumns());
        assertArrayEquals(new int[] {0, 2}, RowReducer.reduce(ab).pivotColumns());
        assertThrows(IndexOutOfBoundsException.class, () -> RowReducer.reduce(ab, 4));
    }

    @Test
    public void reducesRealMatrices() {
        DenseMatrix<Real> a = DenseMatrix.fromRows(Arrays.asList(
                Arrays.asList(Real.of(0), Real.of(2)),
                Arrays.asList(Real.of(4), Real.of(8))));
        RrefResult<Real> rr = RowReducer.reduce(a);
        assertEquals(DenseMatrix.identity(2, Real.ONE), rr.matrix());
        assertEquals(1, rr.swaps());
        assertEquals(Real.of(8), rr.pivotProduct());
    }
}
