package com.traffic.forecast.model;

import java.time.LocalDateTime;

public class TrafficPrediction {
    private final LocalDateTime timestamp;
    private final CongestionLevel congestionLevel;
    private final double averageSpeed;
    private final double confidence;

    public TrafficPrediction(LocalDateTime timestamp, CongestionLevel congestionLevel,
                             double averageSpeed, double confidence) {
        this.timestamp = timestamp;
        this.congestionLevel = congestionLevel;
        this.averageSpeed = averageSpeed;
        this.confidence = confidence;
    }

    public LocalDateTime getTimestamp() { return timestamp; }
    public CongestionLevel getCongestionLevel() { return congestionLevel; }
    public double getAverageSpeed() { return averageSpeed; }
    public double getConfidence() { return confidence; }

    @Override
    public String toString() {
        return String.format("%s %s %.0fkm/h conf=%.2f", timestamp, congestionLevel, averageSpeed, confidence);
    }
}
