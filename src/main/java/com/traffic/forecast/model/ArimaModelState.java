package com.traffic.forecast.model;

/**
 * Fitted ARIMA(p,d,q) parameters. Coefficients hold the p AR terms followed by the q MA terms.
 */
public class ArimaModelState {
    private final int p;
    private final int d;
    private final int q;
    private final double[] coefficients;
    private final double[] residuals;
    private final double aic;
    private final double bic;

    public ArimaModelState(int p, int d, int q, double[] coefficients, double[] residuals, double aic, double bic) {
        this.p = p;
        this.d = d;
        this.q = q;
        this.coefficients = coefficients.clone();
        this.residuals = residuals.clone();
        this.aic = aic;
        this.bic = bic;
    }

    public int getP() { return p; }
    public int getD() { return d; }
    public int getQ() { return q; }
    public double[] getCoefficients() { return coefficients.clone(); }
    public double[] getResiduals() { return residuals.clone(); }
    public double getAic() { return aic; }
    public double getBic() { return bic; }

    public double[] getArCoefficients() {
        double[] ar = new double[p];
        System.arraycopy(coefficients, 0, ar, 0, p);
        return ar;
    }

    public double[] getMaCoefficients() {
        double[] ma = new double[q];
        System.arraycopy(coefficients, p, ma, 0, q);
        return ma;
    }

    @Override
    public String toString() {
        return String.format("ARIMA(%d,%d,%d) aic=%.3f bic=%.3f", p, d, q, aic, bic);
    }
}
