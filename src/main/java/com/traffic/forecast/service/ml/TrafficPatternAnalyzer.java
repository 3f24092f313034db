package com.traffic.forecast.service.ml;

import com.traffic.forecast.exception.NotTrainedException;
import com.traffic.forecast.model.CongestionPattern;
import com.traffic.forecast.model.CongestionPatternType;
import com.traffic.forecast.model.DayOfWeekPattern;
import com.traffic.forecast.model.GeoArea;
import com.traffic.forecast.model.HourlyTrafficPattern;
import com.traffic.forecast.model.SeasonalPattern;
import com.traffic.forecast.model.TrafficObservation;
import com.traffic.forecast.model.TrafficPrediction;
import com.traffic.forecast.model.WeatherConditions;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Descriptive aggregates over the history (hour of day, day of week, month) plus the
 * recurring congestion triggers, and a point estimate built by multiplying them together.
 * No fitting is involved.
 */
public class TrafficPatternAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TrafficPatternAnalyzer.class);

    static final String[] DAY_NAMES = {
        "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
    };
    static final String[] MONTH_NAMES = {
        "January", "February", "March", "April", "May", "June",
        "July", "August", "September", "October", "November", "December"
    };

    public static final String CITY_WIDE = "city_wide";

    private static final double DEFAULT_CONGESTION = 1.5;
    private static final double INTERPOLATED_STD_DEV = 0.5;
    private static final double INTERPOLATED_PEAK_PROBABILITY = 0.1;
    private static final double PEAK_THRESHOLD = 2.0;
    private static final double PEAK_HOUR_MARGIN = 0.5;
    private static final double WEEKEND_FACTOR = 0.7;
    private static final double SEVERITY_WEIGHT = 0.3;

    private List<HourlyTrafficPattern> hourlyPatterns = List.of();
    private List<DayOfWeekPattern> dayOfWeekPatterns = List.of();
    private List<SeasonalPattern> seasonalPatterns = List.of();
    private List<CongestionPattern> congestionPatterns = List.of();

    /**
     * Rebuilds the 24-entry hour-of-day table. Hours without data copy the previous
     * hour's average (1.5 for hour 0) with a fixed spread of 0.5.
     */
    public List<HourlyTrafficPattern> analyzeHourly(List<TrafficObservation> history) {
        List<List<Double>> byHour = bucket(24);
        for (TrafficObservation observation : history) {
            byHour.get(observation.getTimestamp().getHour()).add(observation.getCongestionLevel());
        }

        List<HourlyTrafficPattern> patterns = new ArrayList<>(24);
        for (int hour = 0; hour < 24; hour++) {
            List<Double> levels = byHour.get(hour);
            if (levels.isEmpty()) {
                double average = hour == 0 ? DEFAULT_CONGESTION : patterns.get(hour - 1).getAverageCongestion();
                patterns.add(new HourlyTrafficPattern(hour, average, INTERPOLATED_STD_DEV,
                    INTERPOLATED_PEAK_PROBABILITY, CongestionScale.estimateSpeed(average)));
                continue;
            }

            double[] values = toArray(levels);
            double average = StatUtils.mean(values);
            double variance = StatUtils.populationVariance(values, average);
            long peaks = levels.stream().filter(level -> level > PEAK_THRESHOLD).count();

            patterns.add(new HourlyTrafficPattern(hour, average, Math.sqrt(variance),
                (double) peaks / levels.size(), CongestionScale.estimateSpeed(average)));
        }

        this.hourlyPatterns = List.copyOf(patterns);
        return hourlyPatterns;
    }

    /**
     * Rebuilds the 7-entry day-of-week table (0 = Sunday). An hour is peak for a day when
     * its mean is more than 0.5 above the day's mean, off-peak when more than 0.5 below.
     */
    public List<DayOfWeekPattern> analyzeDayOfWeek(List<TrafficObservation> history) {
        List<List<Double>> byDay = bucket(7);
        List<List<List<Double>>> byDayHour = new ArrayList<>(7);
        for (int day = 0; day < 7; day++) {
            byDayHour.add(bucket(24));
        }
        for (TrafficObservation observation : history) {
            int day = dayOfWeek(observation.getTimestamp());
            byDay.get(day).add(observation.getCongestionLevel());
            byDayHour.get(day).get(observation.getTimestamp().getHour()).add(observation.getCongestionLevel());
        }

        List<DayOfWeekPattern> patterns = new ArrayList<>(7);
        for (int day = 0; day < 7; day++) {
            List<Double> levels = byDay.get(day);
            double average = levels.isEmpty() ? DEFAULT_CONGESTION : mean(levels);

            List<Integer> peakHours = new ArrayList<>();
            List<Integer> offPeakHours = new ArrayList<>();
            for (int hour = 0; hour < 24; hour++) {
                List<Double> hourLevels = byDayHour.get(day).get(hour);
                if (hourLevels.isEmpty()) continue;
                double hourAverage = mean(hourLevels);
                if (hourAverage > average + PEAK_HOUR_MARGIN) {
                    peakHours.add(hour);
                } else if (hourAverage < average - PEAK_HOUR_MARGIN) {
                    offPeakHours.add(hour);
                }
            }

            double weekendFactor = isWeekend(day) ? WEEKEND_FACTOR : 1.0;
            patterns.add(new DayOfWeekPattern(day, DAY_NAMES[day], average, peakHours, offPeakHours, weekendFactor));
        }

        this.dayOfWeekPatterns = List.copyOf(patterns);
        return dayOfWeekPatterns;
    }

    /**
     * Rebuilds the 12-entry month table (0 = January). The weather factor comes from the
     * month's average rainfall and visibility; holiday and school-season factors are fixed
     * by month.
     */
    public List<SeasonalPattern> analyzeSeasonal(List<TrafficObservation> history) {
        List<List<Double>> byMonth = bucket(12);
        List<List<WeatherConditions>> weatherByMonth = bucket(12);
        for (TrafficObservation observation : history) {
            int month = month(observation.getTimestamp());
            byMonth.get(month).add(observation.getCongestionLevel());
            if (observation.getWeatherConditions() != null) {
                weatherByMonth.get(month).add(observation.getWeatherConditions());
            }
        }

        List<SeasonalPattern> patterns = new ArrayList<>(12);
        for (int month = 0; month < 12; month++) {
            List<Double> levels = byMonth.get(month);
            double average = levels.isEmpty() ? DEFAULT_CONGESTION : mean(levels);

            double weatherFactor = 1.0;
            List<WeatherConditions> weather = weatherByMonth.get(month);
            if (!weather.isEmpty()) {
                double rainfall = 0;
                double visibility = 0;
                for (WeatherConditions conditions : weather) {
                    rainfall += conditions.getRainfall();
                    visibility += conditions.getVisibility();
                }
                rainfall /= weather.size();
                visibility /= weather.size();
                weatherFactor = 1.0 + rainfall / 10 + (10 - visibility) / 20;
            }

            double holidayFactor = (month == 11 || month == 0) ? 1.2 : 1.0;
            double schoolFactor = (month == 5 || month == 6) ? 0.8 : 1.0;
            patterns.add(new SeasonalPattern(month, MONTH_NAMES[month], average, weatherFactor, holidayFactor, schoolFactor));
        }

        this.seasonalPatterns = List.copyOf(patterns);
        return seasonalPatterns;
    }

    /**
     * Looks for the four recurring trigger types and keeps those with evidence in the
     * history, in the order rush hour, event, weather, seasonal.
     */
    public List<CongestionPattern> detectCongestionPatterns(List<TrafficObservation> history) {
        List<CongestionPattern> patterns = new ArrayList<>(4);

        List<TrafficObservation> rushHour = history.stream()
            .filter(o -> isRushHour(o.getTimestamp().getHour()))
            .collect(Collectors.toList());
        if (!rushHour.isEmpty()) {
            patterns.add(new CongestionPattern(
                CongestionPatternType.RUSH_HOUR,
                List.of("weekday", "time:7-10", "time:17-20"),
                180,
                severity(rushHour),
                areaIds(rushHour),
                List.of("Use alternative routes", "Adjust departure time",
                    "Consider public transport", "Implement staggered work hours")));
        }

        List<TrafficObservation> events = history.stream()
            .filter(o -> !o.getEventFactors().isEmpty())
            .collect(Collectors.toList());
        if (!events.isEmpty()) {
            patterns.add(new CongestionPattern(
                CongestionPatternType.EVENT_BASED,
                List.of("special_events", "festivals", "sports_events"),
                240,
                severity(events),
                areaIds(events),
                List.of("Plan alternative routes in advance", "Allow extra travel time",
                    "Monitor traffic updates", "Consider postponing non-essential trips")));
        }

        List<TrafficObservation> badWeather = history.stream()
            .filter(o -> isAdverseWeather(o.getWeatherConditions()))
            .collect(Collectors.toList());
        if (!badWeather.isEmpty()) {
            patterns.add(new CongestionPattern(
                CongestionPatternType.WEATHER_RELATED,
                List.of("heavy_rain", "poor_visibility", "fog", "extreme_weather"),
                120,
                severity(badWeather),
                areaIds(badWeather),
                List.of("Drive cautiously and slowly", "Increase following distance",
                    "Use headlights and hazard lights", "Consider delaying travel if possible")));
        }

        List<TrafficObservation> busyMonths = highCongestionMonths(history);
        if (!busyMonths.isEmpty()) {
            patterns.add(new CongestionPattern(
                CongestionPatternType.SEASONAL,
                List.of("winter_months", "festival_season", "school_season"),
                30 * 24 * 60,
                severity(busyMonths),
                List.of(CITY_WIDE),
                List.of("Plan for seasonal traffic increases", "Use public transport during peak seasons",
                    "Consider flexible work arrangements", "Monitor seasonal traffic advisories")));
        }

        for (CongestionPattern pattern : patterns) {
            log.debug("Detected {} pattern with severity {}", pattern.getPatternType().getLabel(), pattern.getSeverityLevel());
        }
        this.congestionPatterns = List.copyOf(patterns);
        return congestionPatterns;
    }

    /**
     * Pattern-informed estimate for one area and hour.
     *
     * @throws NotTrainedException if {@link #analyzeHourly} has not run
     */
    public TrafficPrediction predictBasedOnPatterns(GeoArea area, LocalDateTime targetTime) {
        if (hourlyPatterns.isEmpty()) {
            throw new NotTrainedException("Traffic patterns have not been analyzed yet");
        }
        int hour = targetTime.getHour();
        int day = dayOfWeek(targetTime);
        int month = month(targetTime);

        HourlyTrafficPattern hourly = hourlyPatterns.get(hour);
        double congestion = hourly.getAverageCongestion();
        double speed = hourly.getTypicalSpeed();

        DayOfWeekPattern dayPattern = find(dayOfWeekPatterns, day);
        if (dayPattern != null) {
            congestion *= dayPattern.getWeekendFactor();
            if (dayPattern.getPeakHours().contains(hour)) {
                congestion *= 1.3;
                speed *= 0.7;
            } else if (dayPattern.getOffPeakHours().contains(hour)) {
                congestion *= 0.8;
                speed *= 1.2;
            }
        }

        SeasonalPattern seasonal = seasonalPatterns.size() == 12 ? seasonalPatterns.get(month) : null;
        if (seasonal != null) {
            congestion *= seasonal.getCombinedFactor();
        }

        for (CongestionPattern pattern : congestionPatterns) {
            if (patternApplies(pattern, targetTime, area)) {
                congestion *= 1 + pattern.getSeverityLevel() * SEVERITY_WEIGHT;
            }
        }

        congestion = CongestionScale.clamp(congestion);
        speed = Math.max(5, Math.min(60, speed));
        return new TrafficPrediction(targetTime, CongestionScale.toLevel(congestion), Math.round(speed),
            confidence(hourly, day));
    }

    /**
     * Whether a detected pattern is active at {@code time}. Rush hour needs a weekday inside
     * one of the time ranges in its trigger conditions; seasonal covers November to February.
     * Weather and event patterns depend on live signals and never apply here.
     */
    public boolean patternApplies(CongestionPattern pattern, LocalDateTime time, GeoArea area) {
        switch (pattern.getPatternType()) {
            case RUSH_HOUR:
                return triggersMatch(pattern.getTriggerConditions(), time);
            case SEASONAL:
                int month = month(time);
                return month >= 10 || month <= 1;
            case WEATHER_RELATED:
            case EVENT_BASED:
            default:
                return false;
        }
    }

    public List<HourlyTrafficPattern> getHourlyPatterns() { return hourlyPatterns; }
    public List<DayOfWeekPattern> getDayOfWeekPatterns() { return dayOfWeekPatterns; }
    public List<SeasonalPattern> getSeasonalPatterns() { return seasonalPatterns; }
    public List<CongestionPattern> getCongestionPatterns() { return congestionPatterns; }

    public boolean isTrained() {
        return !hourlyPatterns.isEmpty();
    }

    // "weekday" requires Mon-Fri; "time:a-b" conditions are alternatives, inclusive on both ends
    private static boolean triggersMatch(List<String> conditions, LocalDateTime time) {
        int hour = time.getHour();
        boolean anyRange = false;
        boolean inRange = false;
        for (String condition : conditions) {
            if ("weekday".equals(condition)) {
                if (isWeekend(dayOfWeek(time))) return false;
            } else if (condition.startsWith("time:")) {
                anyRange = true;
                String[] bounds = condition.substring("time:".length()).split("-");
                int from = Integer.parseInt(bounds[0].trim());
                int to = Integer.parseInt(bounds[1].trim());
                if (hour >= from && hour <= to) inRange = true;
            }
        }
        return !anyRange || inRange;
    }

    private double confidence(HourlyTrafficPattern hourly, int day) {
        double confidence = 0.7;
        if (hourly.getStandardDeviation() < 0.5) {
            confidence += 0.1;
        }
        confidence += isWeekend(day) ? -0.1 : 0.1;
        if (hourlyPatterns.size() + dayOfWeekPatterns.size() + seasonalPatterns.size() < 10) {
            confidence -= 0.2;
        }
        return CongestionScale.clampConfidence(confidence);
    }

    /** Observations in months whose mean congestion is more than 0.5 above the mean of monthly means. */
    private static List<TrafficObservation> highCongestionMonths(List<TrafficObservation> history) {
        List<List<TrafficObservation>> byMonth = bucket(12);
        for (TrafficObservation observation : history) {
            byMonth.get(month(observation.getTimestamp())).add(observation);
        }

        double[] monthly = new double[12];
        double total = 0;
        int populated = 0;
        for (int month = 0; month < 12; month++) {
            List<TrafficObservation> observations = byMonth.get(month);
            if (observations.isEmpty()) continue;
            monthly[month] = observations.stream().mapToDouble(TrafficObservation::getCongestionLevel).average().orElse(0);
            total += monthly[month];
            populated++;
        }
        if (populated == 0) {
            return List.of();
        }
        double overall = total / populated;

        List<TrafficObservation> subset = new ArrayList<>();
        for (int month = 0; month < 12; month++) {
            if (!byMonth.get(month).isEmpty() && monthly[month] > overall + 0.5) {
                subset.addAll(byMonth.get(month));
            }
        }
        return subset;
    }

    private static boolean isAdverseWeather(WeatherConditions weather) {
        return weather != null && (weather.getRainfall() > 5 || weather.getVisibility() < 5);
    }

    private static double severity(List<TrafficObservation> subset) {
        double average = subset.stream().mapToDouble(TrafficObservation::getCongestionLevel).average().orElse(0);
        return Math.min(CongestionScale.MAX_LEVEL, average);
    }

    private static List<String> areaIds(List<TrafficObservation> subset) {
        return subset.stream().map(o -> o.getArea().getId()).distinct().collect(Collectors.toList());
    }

    private static DayOfWeekPattern find(List<DayOfWeekPattern> patterns, int day) {
        for (DayOfWeekPattern pattern : patterns) {
            if (pattern.getDayOfWeek() == day) return pattern;
        }
        return null;
    }

    static boolean isRushHour(int hour) {
        return (hour >= 7 && hour <= 10) || (hour >= 17 && hour <= 20);
    }

    static boolean isWeekend(int day) {
        return day == 0 || day == 6;
    }

    /** 0 = Sunday .. 6 = Saturday. */
    static int dayOfWeek(LocalDateTime time) {
        return time.getDayOfWeek().getValue() % 7;
    }

    static int month(LocalDateTime time) {
        return time.getMonthValue() - 1;
    }

    private static double mean(List<Double> values) {
        return StatUtils.mean(toArray(values));
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static <T> List<List<T>> bucket(int size) {
        List<List<T>> buckets = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            buckets.add(new ArrayList<>());
        }
        return buckets;
    }
}
