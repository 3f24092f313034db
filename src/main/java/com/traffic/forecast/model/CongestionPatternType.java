package com.traffic.forecast.model;

public enum CongestionPatternType {
    RUSH_HOUR("rush_hour"),
    EVENT_BASED("event_based"),
    WEATHER_RELATED("weather_related"),
    SEASONAL("seasonal");

    private final String label;

    CongestionPatternType(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }
}
