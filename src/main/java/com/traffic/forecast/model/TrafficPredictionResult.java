package com.traffic.forecast.model;

import java.util.List;

public class TrafficPredictionResult {
    private List<TrafficPrediction> predictions;
    private double confidence;
    private String modelUsed;
    private ModelAccuracy accuracy;
    private List<PredictionFactor> factors;

    public TrafficPredictionResult() {}

    // Getters and Setters
    public List<TrafficPrediction> getPredictions() { return predictions; }
    public void setPredictions(List<TrafficPrediction> predictions) { this.predictions = predictions; }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }

    public String getModelUsed() { return modelUsed; }
    public void setModelUsed(String modelUsed) { this.modelUsed = modelUsed; }

    public ModelAccuracy getAccuracy() { return accuracy; }
    public void setAccuracy(ModelAccuracy accuracy) { this.accuracy = accuracy; }

    public List<PredictionFactor> getFactors() { return factors; }
    public void setFactors(List<PredictionFactor> factors) { this.factors = factors; }
}
