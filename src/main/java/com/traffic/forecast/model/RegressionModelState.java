package com.traffic.forecast.model;

public class RegressionModelState {
    private final double[] coefficients;
    private final double intercept;
    private final double rSquared;
    private final double meanSquaredError;
    private final double meanAbsoluteError;

    public RegressionModelState(double[] coefficients, double intercept, double rSquared,
                                double meanSquaredError, double meanAbsoluteError) {
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
        this.rSquared = rSquared;
        this.meanSquaredError = meanSquaredError;
        this.meanAbsoluteError = meanAbsoluteError;
    }

    public double[] getCoefficients() { return coefficients.clone(); }
    public double getIntercept() { return intercept; }
    public double getRSquared() { return rSquared; }
    public double getMeanSquaredError() { return meanSquaredError; }
    public double getMeanAbsoluteError() { return meanAbsoluteError; }

    /** intercept + coefficients . features */
    public double evaluate(double[] features) {
        double sum = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            sum += coefficients[i] * features[i];
        }
        return sum;
    }
}
