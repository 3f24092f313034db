package com.traffic.forecast.service.ml;

import com.traffic.forecast.model.CongestionLevel;

/**
 * Conversions between the numeric congestion scale and reporting values.
 */
public final class CongestionScale {

    public static final double MIN_LEVEL = 0.0;
    public static final double MAX_LEVEL = 3.0;

    // Typical urban speeds (km/h) at congestion 0, 1, 2, 3
    private static final double[] ANCHOR_SPEEDS = {45, 25, 15, 8};

    private CongestionScale() {}

    public static double clamp(double value) {
        return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, value));
    }

    public static CongestionLevel toLevel(double value) {
        return CongestionLevel.fromValue(value);
    }

    /**
     * Linear interpolation between the anchor speeds, rounded to whole km/h.
     * Values outside [0,3] are clamped first.
     */
    public static double estimateSpeed(double congestion) {
        double level = clamp(congestion);
        int lower = (int) Math.floor(level);
        int upper = (int) Math.ceil(level);
        double fraction = level - lower;
        double speed = ANCHOR_SPEEDS[lower] + fraction * (ANCHOR_SPEEDS[upper] - ANCHOR_SPEEDS[lower]);
        return Math.round(speed);
    }

    public static double clampConfidence(double confidence) {
        return Math.max(0.1, Math.min(1.0, confidence));
    }
}
