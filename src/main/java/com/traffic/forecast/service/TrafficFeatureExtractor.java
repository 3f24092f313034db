package com.traffic.forecast.service;

import com.traffic.forecast.model.EventFactor;
import com.traffic.forecast.model.GeoArea;
import com.traffic.forecast.model.RegressionSample;
import com.traffic.forecast.model.TrafficFeatures;
import com.traffic.forecast.model.TrafficObservation;
import com.traffic.forecast.model.WeatherConditions;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Service
public class TrafficFeatureExtractor {

    static final double DEFAULT_WEATHER_SCORE = 0.8;
    static final double DEFAULT_EVENT_IMPACT = 0.1;

    // Republic Day, Independence Day, Gandhi Jayanti
    private static final Set<MonthDay> FIXED_HOLIDAYS = Set.of(
        MonthDay.of(1, 26), MonthDay.of(8, 15), MonthDay.of(10, 2));

    // Typical congestion by hour of day
    private static final double[] WEEKDAY_PROFILE = {
        1.0, 1.2, 1.5, 2.0, 2.5, 2.8, 2.5, 2.0, 1.8, 1.5, 1.3, 1.2,
        1.0, 0.8, 0.6, 0.8, 1.0, 1.5, 2.2, 2.8, 2.5, 2.0, 1.5, 1.2
    };
    private static final double[] WEEKEND_PROFILE = {
        0.8, 0.6, 0.5, 0.4, 0.4, 0.5, 0.8, 1.2, 1.5, 1.8, 2.0, 2.2,
        2.0, 1.8, 1.5, 1.3, 1.2, 1.5, 1.8, 2.0, 1.8, 1.5, 1.2, 1.0
    };

    /**
     * Features for a time with no live conditions known.
     */
    public TrafficFeatures extract(GeoArea area, LocalDateTime timestamp) {
        return extract(area, timestamp, null, List.of());
    }

    /**
     * Features for a time under the given weather and events. A null weather or an empty
     * event list falls back to the default scores.
     */
    public TrafficFeatures extract(GeoArea area, LocalDateTime timestamp,
                                   WeatherConditions weather, List<EventFactor> events) {
        int hour = timestamp.getHour();
        int dayOfWeek = timestamp.getDayOfWeek().getValue() % 7;  // 0 = Sunday
        boolean weekend = timestamp.getDayOfWeek() == DayOfWeek.SATURDAY
            || timestamp.getDayOfWeek() == DayOfWeek.SUNDAY;

        return new TrafficFeatures(
            hour,
            dayOfWeek,
            timestamp.getMonthValue() - 1,
            weekend,
            isHoliday(timestamp),
            weather == null ? DEFAULT_WEATHER_SCORE : weatherScore(weather),
            eventImpact(events),
            historicalAverage(hour, weekend),
            0,
            area.getZoneType().getCode());
    }

    /** Pairs each observation's features with its measured congestion. */
    public List<RegressionSample> toRegressionSamples(List<TrafficObservation> history) {
        List<RegressionSample> samples = new ArrayList<>(history.size());
        for (TrafficObservation observation : history) {
            TrafficFeatures features = extract(observation.getArea(), observation.getTimestamp(),
                observation.getWeatherConditions(), observation.getEventFactors());
            samples.add(new RegressionSample(features, observation.getCongestionLevel()));
        }
        return samples;
    }

    /**
     * 1.0 for good conditions, reduced for rain, poor visibility and extreme
     * temperatures. Never below 0.
     */
    static double weatherScore(WeatherConditions weather) {
        double score = 1.0;
        if (weather.getRainfall() > 0) {
            score -= Math.min(0.5, weather.getRainfall() / 20);
        }
        if (weather.getVisibility() < 10) {
            score -= Math.min(0.3, (10 - weather.getVisibility()) / 20);
        }
        if (weather.getTemperature() > 40 || weather.getTemperature() < 5) {
            score -= 0.1;
        }
        return Math.max(0, score);
    }

    static double eventImpact(List<EventFactor> events) {
        if (events == null || events.isEmpty()) {
            return DEFAULT_EVENT_IMPACT;
        }
        double total = 0;
        for (EventFactor event : events) {
            total += event.getSeverity();
        }
        return Math.min(1.0, total);
    }

    static boolean isHoliday(LocalDateTime timestamp) {
        return FIXED_HOLIDAYS.contains(MonthDay.from(timestamp));
    }

    static double historicalAverage(int hour, boolean weekend) {
        return weekend ? WEEKEND_PROFILE[hour] : WEEKDAY_PROFILE[hour];
    }
}
