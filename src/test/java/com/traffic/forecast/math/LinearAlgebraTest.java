package com.traffic.forecast.math;

import com.traffic.forecast.exception.SingularMatrixException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LinearAlgebraTest {

    @Test
    void transposeSwapsRowsAndColumns() {
        double[][] m = {{1, 2, 3}, {4, 5, 6}};

        double[][] t = LinearAlgebra.transpose(m);

        assertEquals(3, t.length);
        assertArrayEquals(new double[] {1, 4}, t[0]);
        assertArrayEquals(new double[] {3, 6}, t[2]);
    }

    @Test
    void multiplyMatrices() {
        double[][] a = {{1, 2}, {3, 4}};
        double[][] b = {{5, 6}, {7, 8}};

        double[][] c = LinearAlgebra.multiply(a, b);

        assertArrayEquals(new double[] {19, 22}, c[0]);
        assertArrayEquals(new double[] {43, 50}, c[1]);
    }

    @Test
    void multiplyRejectsMismatchedDimensions() {
        assertThrows(IllegalArgumentException.class,
            () -> LinearAlgebra.multiply(new double[][] {{1, 2}}, new double[][] {{1, 2}}));
    }

    @Test
    // The first pivot is zero, so a row swap is required
    void solveNeedsRowSwap() {
        double[][] a = {{0, 1}, {2, 3}};
        double[] b = {4, 13};

        double[] x = LinearAlgebra.solve(a, b);

        assertEquals(0.5, x[0], 1e-12);
        assertEquals(4.0, x[1], 1e-12);
        // inputs untouched
        assertEquals(0, a[0][0]);
        assertEquals(4, b[0]);
    }

    @Test
    void solveThreeByThree() {
        double[][] a = {{2, 1, -1}, {-3, -1, 2}, {-2, 1, 2}};
        double[] b = {8, -11, -3};

        double[] x = LinearAlgebra.solve(a, b);

        assertArrayEquals(new double[] {2, 3, -1}, x, 1e-9);
    }

    @Test
    void singularSystemThrows() {
        double[][] a = {{1, 2}, {2, 4}};

        SingularMatrixException e = assertThrows(SingularMatrixException.class,
            () -> LinearAlgebra.solve(a, new double[] {1, 2}));
        assertEquals(2, e.getDimension());
    }

    @Test
    void normalEquationRecoversExactLine() {
        // y = 1 + 2x
        double[][] x = {{1, 0}, {1, 1}, {1, 2}, {1, 3}};
        double[] y = {1, 3, 5, 7};

        double[] beta = LinearAlgebra.solveNormalEquation(x, y, 0);

        assertArrayEquals(new double[] {1, 2}, beta, 1e-9);
    }

    @Test
    void ridgePenaltyMakesDuplicatedColumnsSolvable() {
        double[][] x = {{1, 1}, {2, 2}, {3, 3}};
        double[] y = {2, 4, 6};

        assertThrows(SingularMatrixException.class, () -> LinearAlgebra.solveNormalEquation(x, y, 0));
        double[] beta = LinearAlgebra.solveNormalEquation(x, y, 0.01);

        assertEquals(beta[0], beta[1], 1e-9);
        assertEquals(1.0, beta[0], 0.01);
    }
}
