package com.traffic.forecast.model;

public class EventFactor {
    private final String type;
    private final double severity;
    private final String description;

    public EventFactor(String type, double severity, String description) {
        if (severity < 0 || severity > 1) {
            throw new IllegalArgumentException("Event severity must be within [0,1]: " + severity);
        }
        this.type = type;
        this.severity = severity;
        this.description = description;
    }

    public String getType() { return type; }
    public double getSeverity() { return severity; }
    public String getDescription() { return description; }
}
