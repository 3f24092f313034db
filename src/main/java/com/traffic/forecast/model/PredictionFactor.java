package com.traffic.forecast.model;

/**
 * Human-readable driver behind a prediction. Positive impact raises congestion.
 */
public class PredictionFactor {
    private final String factor;
    private final double impact;
    private final double confidence;
    private final String description;

    public PredictionFactor(String factor, double impact, double confidence, String description) {
        this.factor = factor;
        this.impact = impact;
        this.confidence = confidence;
        this.description = description;
    }

    public String getFactor() { return factor; }
    public double getImpact() { return impact; }
    public double getConfidence() { return confidence; }
    public String getDescription() { return description; }
}
