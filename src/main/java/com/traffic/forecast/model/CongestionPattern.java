package com.traffic.forecast.model;

import java.util.List;

/**
 * A recurring congestion trigger found in the history, e.g. rush hour or heavy rain.
 * Severity is on the congestion scale (0..3); duration is in minutes.
 */
public class CongestionPattern {
    private final CongestionPatternType patternType;
    private final List<String> triggerConditions;
    private final int averageDuration;
    private final double severityLevel;
    private final List<String> affectedAreas;
    private final List<String> mitigationStrategies;

    public CongestionPattern(CongestionPatternType patternType, List<String> triggerConditions, int averageDuration,
                             double severityLevel, List<String> affectedAreas, List<String> mitigationStrategies) {
        this.patternType = patternType;
        this.triggerConditions = List.copyOf(triggerConditions);
        this.averageDuration = averageDuration;
        this.severityLevel = severityLevel;
        this.affectedAreas = List.copyOf(affectedAreas);
        this.mitigationStrategies = List.copyOf(mitigationStrategies);
    }

    public CongestionPatternType getPatternType() { return patternType; }
    public List<String> getTriggerConditions() { return triggerConditions; }
    public int getAverageDuration() { return averageDuration; }
    public double getSeverityLevel() { return severityLevel; }
    public List<String> getAffectedAreas() { return affectedAreas; }
    public List<String> getMitigationStrategies() { return mitigationStrategies; }
}
