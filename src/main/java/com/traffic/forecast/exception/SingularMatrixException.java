package com.traffic.forecast.exception;

/**
 * The linear system handed to the solver has a zero (or numerically zero) pivot.
 */
public class SingularMatrixException extends TrafficForecastException {

    private final int dimension;

    public SingularMatrixException(int dimension) {
        super("Matrix of dimension " + dimension + " is singular or near-singular");
        this.dimension = dimension;
    }

    public int getDimension() { return dimension; }
}
