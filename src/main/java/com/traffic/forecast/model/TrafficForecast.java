package com.traffic.forecast.model;

import java.util.List;

public class TrafficForecast {

    public static final String MODEL_ENSEMBLE = "ensemble_ml_models";
    public static final String MODEL_PATTERN_FALLBACK = "pattern_analysis_fallback";
    public static final String MODEL_BASIC_EXTRAPOLATION = "basic_extrapolation";

    private GeoArea area;
    private TimeWindow timeWindow;
    private List<TrafficPrediction> predictions;
    private double confidence;
    private String modelUsed;

    public TrafficForecast() {}

    public TrafficForecast(GeoArea area, TimeWindow timeWindow, List<TrafficPrediction> predictions,
                           double confidence, String modelUsed) {
        this.area = area;
        this.timeWindow = timeWindow;
        this.predictions = predictions;
        this.confidence = confidence;
        this.modelUsed = modelUsed;
    }

    // Getters and Setters
    public GeoArea getArea() { return area; }
    public void setArea(GeoArea area) { this.area = area; }

    public TimeWindow getTimeWindow() { return timeWindow; }
    public void setTimeWindow(TimeWindow timeWindow) { this.timeWindow = timeWindow; }

    public List<TrafficPrediction> getPredictions() { return predictions; }
    public void setPredictions(List<TrafficPrediction> predictions) { this.predictions = predictions; }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }

    public String getModelUsed() { return modelUsed; }
    public void setModelUsed(String modelUsed) { this.modelUsed = modelUsed; }
}
