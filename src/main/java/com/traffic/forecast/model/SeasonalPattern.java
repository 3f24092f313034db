package com.traffic.forecast.model;

public class SeasonalPattern {
    private final int month;  // 0 = January
    private final String monthName;
    private final double averageCongestion;
    private final double weatherImpactFactor;
    private final double holidayImpactFactor;
    private final double schoolSeasonFactor;

    public SeasonalPattern(int month, String monthName, double averageCongestion, double weatherImpactFactor,
                           double holidayImpactFactor, double schoolSeasonFactor) {
        this.month = month;
        this.monthName = monthName;
        this.averageCongestion = averageCongestion;
        this.weatherImpactFactor = weatherImpactFactor;
        this.holidayImpactFactor = holidayImpactFactor;
        this.schoolSeasonFactor = schoolSeasonFactor;
    }

    public int getMonth() { return month; }
    public String getMonthName() { return monthName; }
    public double getAverageCongestion() { return averageCongestion; }
    public double getWeatherImpactFactor() { return weatherImpactFactor; }
    public double getHolidayImpactFactor() { return holidayImpactFactor; }
    public double getSchoolSeasonFactor() { return schoolSeasonFactor; }

    /** Product of the weather, holiday and school-season multipliers. */
    public double getCombinedFactor() {
        return weatherImpactFactor * holidayImpactFactor * schoolSeasonFactor;
    }
}
