package com.traffic.forecast.service.ml;

import com.traffic.forecast.TrafficTestData;
import com.traffic.forecast.exception.NotTrainedException;
import com.traffic.forecast.model.CongestionLevel;
import com.traffic.forecast.model.CongestionPattern;
import com.traffic.forecast.model.CongestionPatternType;
import com.traffic.forecast.model.DayOfWeekPattern;
import com.traffic.forecast.model.EventFactor;
import com.traffic.forecast.model.GeoArea;
import com.traffic.forecast.model.HourlyTrafficPattern;
import com.traffic.forecast.model.SeasonalPattern;
import com.traffic.forecast.model.TrafficObservation;
import com.traffic.forecast.model.TrafficPrediction;
import com.traffic.forecast.model.WeatherConditions;
import com.traffic.forecast.model.ZoneType;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrafficPatternAnalyzerTest {

    private static final LocalDateTime MONDAY = TrafficTestData.MONDAY_MIDNIGHT;

    @Test
    void missingHoursCopyThePreviousHour() {
        List<TrafficObservation> history = new ArrayList<>();
        for (int hour = 3; hour < 24; hour++) {
            if (hour == 6) continue;
            history.add(TrafficTestData.observation(MONDAY.plusHours(hour), hour == 5 ? 2.0 : 1.0));
        }

        List<HourlyTrafficPattern> hourly = new TrafficPatternAnalyzer().analyzeHourly(history);

        assertEquals(24, hourly.size());
        for (int hour = 0; hour <= 2; hour++) {
            assertEquals(1.5, hourly.get(hour).getAverageCongestion());
            assertEquals(0.5, hourly.get(hour).getStandardDeviation());
            assertEquals(0.1, hourly.get(hour).getPeakProbability());
            assertEquals(20, hourly.get(hour).getTypicalSpeed());
        }
        assertEquals(2.0, hourly.get(6).getAverageCongestion());
        assertEquals(0.5, hourly.get(6).getStandardDeviation());
    }

    @Test
    void hourlyStatistics() {
        double[] levels = {2.5, 1.0, 2.1, 3.0};
        List<TrafficObservation> history = new ArrayList<>();
        for (int day = 0; day < levels.length; day++) {
            history.add(TrafficTestData.observation(MONDAY.plusDays(day).withHour(8), levels[day]));
        }

        HourlyTrafficPattern eight = new TrafficPatternAnalyzer().analyzeHourly(history).get(8);

        assertEquals(8, eight.getHour());
        assertEquals(2.15, eight.getAverageCongestion(), 1e-9);
        assertEquals(Math.sqrt(0.5425), eight.getStandardDeviation(), 1e-9);
        assertEquals(0.75, eight.getPeakProbability(), 1e-9);
        assertEquals(14, eight.getTypicalSpeed());
    }

    @Test
    void dayOfWeekPeaksAndWeekendFactor() {
        List<TrafficObservation> history = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            double level = hour == 8 ? 2.5 : hour == 3 ? 0.2 : 1.0;
            history.add(TrafficTestData.observation(MONDAY.plusHours(hour), level));
        }

        List<DayOfWeekPattern> days = new TrafficPatternAnalyzer().analyzeDayOfWeek(history);

        assertEquals(7, days.size());
        DayOfWeekPattern monday = days.get(1);
        assertEquals("Monday", monday.getDayName());
        assertEquals((22 + 2.5 + 0.2) / 24, monday.getAverageCongestion(), 1e-9);
        assertEquals(List.of(8), monday.getPeakHours());
        assertEquals(List.of(3), monday.getOffPeakHours());
        assertEquals(1.0, monday.getWeekendFactor());

        assertEquals("Sunday", days.get(0).getDayName());
        assertEquals(0.7, days.get(0).getWeekendFactor());
        assertEquals(0.7, days.get(6).getWeekendFactor());
        // no data for Tuesday
        assertEquals(1.5, days.get(2).getAverageCongestion());
        assertTrue(days.get(2).getPeakHours().isEmpty());
    }

    @Test
    void seasonalFactors() {
        WeatherConditions storm = new WeatherConditions(22, 90, 10, 4, 20);
        List<TrafficObservation> history = List.of(
            new TrafficObservation(MONDAY.withHour(9), TrafficTestData.CONNAUGHT_PLACE, 2.0, 20, 1.5, storm, List.of()),
            new TrafficObservation(MONDAY.withHour(10), TrafficTestData.CONNAUGHT_PLACE, 2.4, 18, 1.6, storm, List.of()));

        List<SeasonalPattern> months = new TrafficPatternAnalyzer().analyzeSeasonal(history);

        assertEquals(12, months.size());
        SeasonalPattern march = months.get(2);
        assertEquals("March", march.getMonthName());
        assertEquals(2.2, march.getAverageCongestion(), 1e-9);
        assertEquals(2.3, march.getWeatherImpactFactor(), 1e-9);
        assertEquals(1.0, march.getHolidayImpactFactor());
        assertEquals(1.0, march.getSchoolSeasonFactor());

        assertEquals(1.2, months.get(0).getHolidayImpactFactor());
        assertEquals(1.2, months.get(11).getHolidayImpactFactor());
        assertEquals(0.8, months.get(5).getSchoolSeasonFactor());
        assertEquals(0.8, months.get(6).getSchoolSeasonFactor());
        assertEquals(1.5, months.get(7).getAverageCongestion());
        assertEquals(1.0, months.get(7).getWeatherImpactFactor());
    }

    @Test
    void onlyRushHourIsDetectedInPlainHistory() {
        List<CongestionPattern> patterns = new TrafficPatternAnalyzer()
            .detectCongestionPatterns(TrafficTestData.constant(MONDAY, 24 * 7, 1.2));

        assertEquals(1, patterns.size());
        CongestionPattern rush = patterns.get(0);
        assertEquals(CongestionPatternType.RUSH_HOUR, rush.getPatternType());
        assertEquals(List.of("weekday", "time:7-10", "time:17-20"), rush.getTriggerConditions());
        assertEquals(180, rush.getAverageDuration());
        assertEquals(1.2, rush.getSeverityLevel(), 1e-9);
        assertEquals(List.of("cp"), rush.getAffectedAreas());
        assertEquals(4, rush.getMitigationStrategies().size());
    }

    @Test
    void eventWeatherAndSeasonalPatternsNeedEvidence() {
        GeoArea ring = new GeoArea("ring", "Ring Road", ZoneType.MIXED);
        WeatherConditions fog = new WeatherConditions(8, 95, 0, 2, 3);
        EventFactor match = new EventFactor("sports", 0.8, "Cricket match");

        List<TrafficObservation> history = new ArrayList<>();
        LocalDateTime january = LocalDateTime.of(2024, 1, 15, 12, 0);
        history.add(new TrafficObservation(january, ring, 2.5, 15, 2.0, fog, List.of()));
        history.add(new TrafficObservation(january.plusHours(1), TrafficTestData.CONNAUGHT_PLACE, 2.5, 15, 2.0, null, List.of(match)));
        history.add(TrafficTestData.observation(LocalDateTime.of(2024, 3, 5, 12, 0), 1.0));

        List<CongestionPattern> patterns = new TrafficPatternAnalyzer().detectCongestionPatterns(history);

        assertEquals(3, patterns.size());

        CongestionPattern event = patterns.get(0);
        assertEquals(CongestionPatternType.EVENT_BASED, event.getPatternType());
        assertEquals(240, event.getAverageDuration());
        assertEquals(List.of("cp"), event.getAffectedAreas());

        CongestionPattern weather = patterns.get(1);
        assertEquals(CongestionPatternType.WEATHER_RELATED, weather.getPatternType());
        assertEquals(120, weather.getAverageDuration());
        assertEquals(List.of("ring"), weather.getAffectedAreas());
        assertEquals(2.5, weather.getSeverityLevel(), 1e-9);

        // January (2.5) is more than 0.5 above the mean of monthly means (1.75)
        CongestionPattern seasonal = patterns.get(2);
        assertEquals(CongestionPatternType.SEASONAL, seasonal.getPatternType());
        assertEquals(30 * 24 * 60, seasonal.getAverageDuration());
        assertEquals(2.5, seasonal.getSeverityLevel(), 1e-9);
        assertEquals(List.of(TrafficPatternAnalyzer.CITY_WIDE), seasonal.getAffectedAreas());
    }

    @Test
    void rushHourTriggersRoundTrip() {
        TrafficPatternAnalyzer analyzer = new TrafficPatternAnalyzer();
        CongestionPattern rush = analyzer.detectCongestionPatterns(TrafficTestData.hourly(MONDAY, 48, 9)).get(0);

        GeoArea area = TrafficTestData.CONNAUGHT_PLACE;
        assertTrue(analyzer.patternApplies(rush, LocalDateTime.of(2024, 1, 8, 8, 0), area));
        assertTrue(analyzer.patternApplies(rush, LocalDateTime.of(2024, 1, 8, 20, 0), area));
        assertFalse(analyzer.patternApplies(rush, LocalDateTime.of(2024, 1, 6, 8, 0), area));
        assertFalse(analyzer.patternApplies(rush, LocalDateTime.of(2024, 1, 8, 12, 0), area));
    }

    @Test
    void seasonalPatternAppliesNovemberToFebruary() {
        CongestionPattern seasonal = new CongestionPattern(CongestionPatternType.SEASONAL,
            List.of("winter_months"), 43200, 2.0, List.of("city_wide"), List.of());
        TrafficPatternAnalyzer analyzer = new TrafficPatternAnalyzer();
        GeoArea area = TrafficTestData.CONNAUGHT_PLACE;

        assertTrue(analyzer.patternApplies(seasonal, LocalDateTime.of(2024, 11, 3, 9, 0), area));
        assertTrue(analyzer.patternApplies(seasonal, LocalDateTime.of(2024, 2, 29, 9, 0), area));
        assertFalse(analyzer.patternApplies(seasonal, LocalDateTime.of(2024, 3, 1, 9, 0), area));
        assertFalse(analyzer.patternApplies(seasonal, LocalDateTime.of(2024, 10, 31, 9, 0), area));
    }

    @Test
    void predictionCombinesTheTables() {
        TrafficPatternAnalyzer analyzer = trainedOnConstantWeek();
        GeoArea area = TrafficTestData.CONNAUGHT_PLACE;

        // 1.2 * (1 + 0.3 * 1.2) for the weekday rush hour
        TrafficPrediction rush = analyzer.predictBasedOnPatterns(area, LocalDateTime.of(2024, 3, 6, 8, 0));
        assertEquals(CongestionLevel.HIGH, rush.getCongestionLevel());
        assertEquals(23, rush.getAverageSpeed());
        assertEquals(0.9, rush.getConfidence(), 1e-9);

        TrafficPrediction noon = analyzer.predictBasedOnPatterns(area, LocalDateTime.of(2024, 3, 6, 12, 0));
        assertEquals(CongestionLevel.MODERATE, noon.getCongestionLevel());
        assertEquals(23, noon.getAverageSpeed());
        assertEquals(0.9, noon.getConfidence(), 1e-9);

        // weekend damping, no rush hour boost
        TrafficPrediction saturday = analyzer.predictBasedOnPatterns(area, LocalDateTime.of(2024, 3, 9, 8, 0));
        assertEquals(CongestionLevel.MODERATE, saturday.getCongestionLevel());
        assertEquals(0.7, saturday.getConfidence(), 1e-9);
    }

    @Test
    void peakHourAdjustsSpeed() {
        List<TrafficObservation> history = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            history.add(TrafficTestData.observation(MONDAY.plusHours(hour), hour == 13 ? 2.0 : 1.0));
        }
        TrafficPatternAnalyzer analyzer = new TrafficPatternAnalyzer();
        analyzer.analyzeHourly(history);
        analyzer.analyzeDayOfWeek(history);
        analyzer.analyzeSeasonal(history);

        TrafficPrediction prediction = analyzer.predictBasedOnPatterns(TrafficTestData.CONNAUGHT_PLACE, MONDAY.withHour(13));

        // 2.0 * 1.3 = 2.6, typical speed 15 * 0.7
        assertEquals(CongestionLevel.SEVERE, prediction.getCongestionLevel());
        assertEquals(11, prediction.getAverageSpeed());
    }

    @Test
    void predictionWorksForAreasWithoutHistory() {
        TrafficPatternAnalyzer analyzer = trainedOnConstantWeek();

        TrafficPrediction prediction = analyzer.predictBasedOnPatterns(TrafficTestData.UNKNOWN_AREA,
            LocalDateTime.of(2024, 3, 6, 8, 0));

        assertEquals(CongestionLevel.HIGH, prediction.getCongestionLevel());
    }

    @Test
    void predictionBeforeAnalysisFails() {
        TrafficPatternAnalyzer analyzer = new TrafficPatternAnalyzer();

        assertFalse(analyzer.isTrained());
        assertThrows(NotTrainedException.class,
            () -> analyzer.predictBasedOnPatterns(TrafficTestData.CONNAUGHT_PLACE, MONDAY));
    }

    private static TrafficPatternAnalyzer trainedOnConstantWeek() {
        List<TrafficObservation> history = TrafficTestData.constant(MONDAY, 24 * 7, 1.2);
        TrafficPatternAnalyzer analyzer = new TrafficPatternAnalyzer();
        analyzer.analyzeHourly(history);
        analyzer.analyzeDayOfWeek(history);
        analyzer.analyzeSeasonal(history);
        analyzer.detectCongestionPatterns(history);
        return analyzer;
    }
}
