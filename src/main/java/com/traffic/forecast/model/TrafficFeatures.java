package com.traffic.forecast.model;

/**
 * Raw feature set for one (area, time) pair. {@link #toVector()} produces the
 * normalized form the regression model is fitted on.
 */
public class TrafficFeatures {

    public static final int DIMENSION = 10;

    private final int hourOfDay;
    private final int dayOfWeek;        // 0 = Sunday
    private final int month;            // 0 = January
    private final boolean weekend;
    private final boolean holiday;
    private final double weatherScore;  // 0 = bad, 1 = good
    private final double eventImpactScore;
    private final double historicalAverage;
    private final double recentTrend;   // -1..1
    private final int zoneType;

    public TrafficFeatures(int hourOfDay, int dayOfWeek, int month, boolean weekend, boolean holiday,
                           double weatherScore, double eventImpactScore, double historicalAverage,
                           double recentTrend, int zoneType) {
        this.hourOfDay = hourOfDay;
        this.dayOfWeek = dayOfWeek;
        this.month = month;
        this.weekend = weekend;
        this.holiday = holiday;
        this.weatherScore = weatherScore;
        this.eventImpactScore = eventImpactScore;
        this.historicalAverage = historicalAverage;
        this.recentTrend = recentTrend;
        this.zoneType = zoneType;
    }

    public double[] toVector() {
        return new double[] {
            hourOfDay / 23.0,
            dayOfWeek / 6.0,
            month / 11.0,
            weekend ? 1 : 0,
            holiday ? 1 : 0,
            weatherScore,
            eventImpactScore,
            historicalAverage / 3.0,
            (recentTrend + 1) / 2.0,
            zoneType / 3.0
        };
    }

    public int getHourOfDay() { return hourOfDay; }
    public int getDayOfWeek() { return dayOfWeek; }
    public int getMonth() { return month; }
    public boolean isWeekend() { return weekend; }
    public boolean isHoliday() { return holiday; }
    public double getWeatherScore() { return weatherScore; }
    public double getEventImpactScore() { return eventImpactScore; }
    public double getHistoricalAverage() { return historicalAverage; }
    public double getRecentTrend() { return recentTrend; }
    public int getZoneType() { return zoneType; }
}
