package com.traffic.forecast.model;

import java.util.List;

public class DayOfWeekPattern {
    private final int dayOfWeek;  // 0 = Sunday
    private final String dayName;
    private final double averageCongestion;
    private final List<Integer> peakHours;
    private final List<Integer> offPeakHours;
    private final double weekendFactor;

    public DayOfWeekPattern(int dayOfWeek, String dayName, double averageCongestion,
                            List<Integer> peakHours, List<Integer> offPeakHours, double weekendFactor) {
        this.dayOfWeek = dayOfWeek;
        this.dayName = dayName;
        this.averageCongestion = averageCongestion;
        this.peakHours = List.copyOf(peakHours);
        this.offPeakHours = List.copyOf(offPeakHours);
        this.weekendFactor = weekendFactor;
    }

    public int getDayOfWeek() { return dayOfWeek; }
    public String getDayName() { return dayName; }
    public double getAverageCongestion() { return averageCongestion; }
    public List<Integer> getPeakHours() { return peakHours; }
    public List<Integer> getOffPeakHours() { return offPeakHours; }
    public double getWeekendFactor() { return weekendFactor; }
}
