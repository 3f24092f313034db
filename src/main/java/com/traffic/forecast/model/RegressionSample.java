package com.traffic.forecast.model;

public class RegressionSample {
    private final TrafficFeatures features;
    private final double target;

    public RegressionSample(TrafficFeatures features, double target) {
        this.features = features;
        this.target = target;
    }

    public TrafficFeatures getFeatures() { return features; }
    public double getTarget() { return target; }
}
