package com.traffic.forecast.model;

public class HourlyTrafficPattern {
    private final int hour;
    private final double averageCongestion;
    private final double standardDeviation;
    private final double peakProbability;
    private final double typicalSpeed;

    public HourlyTrafficPattern(int hour, double averageCongestion, double standardDeviation,
                                double peakProbability, double typicalSpeed) {
        this.hour = hour;
        this.averageCongestion = averageCongestion;
        this.standardDeviation = standardDeviation;
        this.peakProbability = peakProbability;
        this.typicalSpeed = typicalSpeed;
    }

    public int getHour() { return hour; }
    public double getAverageCongestion() { return averageCongestion; }
    public double getStandardDeviation() { return standardDeviation; }
    public double getPeakProbability() { return peakProbability; }
    public double getTypicalSpeed() { return typicalSpeed; }
}
