package com.traffic.forecast.model;

/**
 * Reporting view of the continuous congestion scalar (0..3).
 */
public enum CongestionLevel {
    LOW("low", 0),
    MODERATE("moderate", 1),
    HIGH("high", 2),
    SEVERE("severe", 3);

    private final String label;
    private final int numericValue;

    CongestionLevel(String label, int numericValue) {
        this.label = label;
        this.numericValue = numericValue;
    }

    public String getLabel() { return label; }

    public int getNumericValue() { return numericValue; }

    /**
     * Maps a numeric congestion value to its category. Upper bounds are inclusive:
     * 0.5 is still LOW, 1.5 MODERATE, 2.5 HIGH.
     */
    public static CongestionLevel fromValue(double value) {
        if (value <= 0.5) return LOW;
        if (value <= 1.5) return MODERATE;
        if (value <= 2.5) return HIGH;
        return SEVERE;
    }

    @Override
    public String toString() {
        return label;
    }
}
