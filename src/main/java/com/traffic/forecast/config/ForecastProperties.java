package com.traffic.forecast.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning for the ensemble, bound from {@code traffic.forecast.*}. The defaults are a
 * complete configuration, so the service can also be built without Spring.
 */
@ConfigurationProperties(prefix = "traffic.forecast")
public class ForecastProperties {

    /** Minimum number of observations accepted by initialize. */
    private int minHistory = 50;

    private int polynomialDegree = 2;

    /** Ridge penalty added to the polynomial normal equation. */
    private double ridgeLambda = 0.01;

    private Weights weights = new Weights();

    public int getMinHistory() { return minHistory; }
    public void setMinHistory(int minHistory) { this.minHistory = minHistory; }

    public int getPolynomialDegree() { return polynomialDegree; }
    public void setPolynomialDegree(int polynomialDegree) { this.polynomialDegree = polynomialDegree; }

    public double getRidgeLambda() { return ridgeLambda; }
    public void setRidgeLambda(double ridgeLambda) { this.ridgeLambda = ridgeLambda; }

    public Weights getWeights() { return weights; }
    public void setWeights(Weights weights) { this.weights = weights; }

    /** Blend weights of the ensemble members. */
    public static class Weights {
        private double pattern = 0.4;
        private double regression = 0.4;
        private double timeSeries = 0.2;

        public double getPattern() { return pattern; }
        public void setPattern(double pattern) { this.pattern = pattern; }

        public double getRegression() { return regression; }
        public void setRegression(double regression) { this.regression = regression; }

        public double getTimeSeries() { return timeSeries; }
        public void setTimeSeries(double timeSeries) { this.timeSeries = timeSeries; }
    }
}
