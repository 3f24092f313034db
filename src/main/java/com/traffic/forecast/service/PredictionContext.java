package com.traffic.forecast.service;

import com.traffic.forecast.model.GeoArea;
import com.traffic.forecast.model.TrafficFeatures;

import java.time.LocalDateTime;

/**
 * What every ensemble member gets asked about: an area, a target hour and the features
 * already extracted for them.
 */
public class PredictionContext {
    private final GeoArea area;
    private final LocalDateTime targetTime;
    private final TrafficFeatures features;

    public PredictionContext(GeoArea area, LocalDateTime targetTime, TrafficFeatures features) {
        this.area = area;
        this.targetTime = targetTime;
        this.features = features;
    }

    public GeoArea getArea() { return area; }
    public LocalDateTime getTargetTime() { return targetTime; }
    public TrafficFeatures getFeatures() { return features; }
}
