package com.traffic.forecast.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * One recorded traffic measurement for an area. Immutable.
 */
public class TrafficObservation {
    private final LocalDateTime timestamp;
    private final GeoArea area;
    private final double congestionLevel;
    private final double averageSpeed;
    private final double travelTimeMultiplier;
    private final WeatherConditions weatherConditions;
    private final List<EventFactor> eventFactors;

    public TrafficObservation(LocalDateTime timestamp, GeoArea area, double congestionLevel,
                              double averageSpeed, double travelTimeMultiplier) {
        this(timestamp, area, congestionLevel, averageSpeed, travelTimeMultiplier, null, List.of());
    }

    public TrafficObservation(LocalDateTime timestamp, GeoArea area, double congestionLevel,
                              double averageSpeed, double travelTimeMultiplier,
                              WeatherConditions weatherConditions, List<EventFactor> eventFactors) {
        if (congestionLevel < 0 || congestionLevel > 3) {
            throw new IllegalArgumentException("Congestion level must be within [0,3]: " + congestionLevel);
        }
        if (averageSpeed <= 0) {
            throw new IllegalArgumentException("Average speed must be positive: " + averageSpeed);
        }
        if (travelTimeMultiplier < 1) {
            throw new IllegalArgumentException("Travel time multiplier must be >= 1: " + travelTimeMultiplier);
        }
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.area = Objects.requireNonNull(area, "area");
        this.congestionLevel = congestionLevel;
        this.averageSpeed = averageSpeed;
        this.travelTimeMultiplier = travelTimeMultiplier;
        this.weatherConditions = weatherConditions;
        this.eventFactors = eventFactors == null ? List.of() : List.copyOf(eventFactors);
    }

    public LocalDateTime getTimestamp() { return timestamp; }
    public GeoArea getArea() { return area; }
    public double getCongestionLevel() { return congestionLevel; }
    public double getAverageSpeed() { return averageSpeed; }
    public double getTravelTimeMultiplier() { return travelTimeMultiplier; }
    public WeatherConditions getWeatherConditions() { return weatherConditions; }
    public List<EventFactor> getEventFactors() { return eventFactors; }
}
