package com.traffic.forecast.math;

import com.traffic.forecast.exception.SingularMatrixException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Dense matrix helpers on plain {@code double[][]} (row-major), backed by Commons Math.
 * No knowledge of any model.
 */
public final class LinearAlgebra {

    /** Pivots with an absolute value below this are treated as zero. */
    public static final double PIVOT_EPSILON = 1e-10;

    private LinearAlgebra() {}

    public static double[][] transpose(double[][] matrix) {
        return MatrixUtils.createRealMatrix(matrix).transpose().getData();
    }

    public static double[][] multiply(double[][] a, double[][] b) {
        if (b.length != a[0].length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + "x" + a[0].length
                + " * " + b.length + "x" + b[0].length);
        }
        return MatrixUtils.createRealMatrix(a).multiply(MatrixUtils.createRealMatrix(b)).getData();
    }

    public static double[] multiply(double[][] matrix, double[] vector) {
        return MatrixUtils.createRealMatrix(matrix).operate(vector);
    }

    public static double dot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector lengths differ: " + a.length + " vs " + b.length);
        }
        return new ArrayRealVector(a, false).dotProduct(new ArrayRealVector(b, false));
    }

    /**
     * Solves {@code A x = b} by LU decomposition with partial (row) pivoting, i.e. Gaussian
     * elimination. The inputs are not modified.
     *
     * @throws SingularMatrixException if a pivot is (numerically) zero
     */
    public static double[] solve(double[][] a, double[] b) {
        int n = a.length;
        if (b.length != n) {
            throw new IllegalArgumentException("Right-hand side has length " + b.length + ", expected " + n);
        }
        for (double[] row : a) {
            if (row.length != n) {
                throw new IllegalArgumentException("Matrix is not square");
            }
        }

        DecompositionSolver solver = new LUDecomposition(MatrixUtils.createRealMatrix(a), PIVOT_EPSILON).getSolver();
        if (!solver.isNonSingular()) {
            throw new SingularMatrixException(n);
        }
        return solver.solve(new ArrayRealVector(b, true)).toArray();
    }

    /**
     * Least-squares solution of {@code X beta = y} through the normal equation
     * {@code (X'X + lambda I) beta = X'y}. A lambda of 0 gives ordinary least squares.
     */
    public static double[] solveNormalEquation(double[][] x, double[] y, double lambda) {
        RealMatrix design = MatrixUtils.createRealMatrix(x);
        RealMatrix xt = design.transpose();
        RealMatrix xtx = xt.multiply(design);
        if (lambda != 0) {
            for (int i = 0; i < xtx.getRowDimension(); i++) {
                xtx.addToEntry(i, i, lambda);
            }
        }
        return solve(xtx.getData(), xt.operate(y));
    }
}
