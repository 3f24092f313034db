package com.traffic.forecast.service;

import com.traffic.forecast.config.ForecastProperties;
import com.traffic.forecast.exception.InsufficientDataException;
import com.traffic.forecast.model.ArimaModelState;
import com.traffic.forecast.model.CongestionLevel;
import com.traffic.forecast.model.CongestionPattern;
import com.traffic.forecast.model.EventFactor;
import com.traffic.forecast.model.GeoArea;
import com.traffic.forecast.model.ModelAccuracy;
import com.traffic.forecast.model.PredictionFactor;
import com.traffic.forecast.model.TimeWindow;
import com.traffic.forecast.model.TrafficFeatures;
import com.traffic.forecast.model.TrafficForecast;
import com.traffic.forecast.model.TrafficObservation;
import com.traffic.forecast.model.TrafficPrediction;
import com.traffic.forecast.model.TrafficPredictionResult;
import com.traffic.forecast.model.WeatherConditions;
import com.traffic.forecast.service.ml.AccuracyCalculator;
import com.traffic.forecast.service.ml.ArimaModel;
import com.traffic.forecast.service.ml.RegressionModel;
import com.traffic.forecast.service.ml.TrafficPatternAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ensemble coordinator. Trains the time-series, regression and pattern models on the
 * history and blends their estimates into one prediction per hour.
 * <p>
 * {@link #initialize} builds a complete new ensemble and only then publishes it, so
 * concurrent predictions always see either the previous ensemble or the new one.
 */
@Service
public class TrafficMLService {

    private static final Logger log = LoggerFactory.getLogger(TrafficMLService.class);

    private final TrafficFeatureExtractor featureExtractor;
    private final ForecastProperties properties;

    private volatile EnsembleState state = EnsembleState.uninitialized();

    @Autowired
    public TrafficMLService(TrafficFeatureExtractor featureExtractor, ForecastProperties properties) {
        this.featureExtractor = featureExtractor;
        this.properties = properties;
    }

    /**
     * Trains all models on the history.
     *
     * @throws InsufficientDataException below the configured minimum history (50 by default)
     * @throws IllegalArgumentException if the configured blend weights cannot be normalized
     */
    public synchronized void initialize(List<TrafficObservation> history) {
        requireUsableWeights();
        int required = properties.getMinHistory();
        if (history.size() < required) {
            throw new InsufficientDataException(
                "Insufficient historical data. Need at least " + required + " data points for reliable ML models",
                required, history.size());
        }
        log.info("Initializing traffic ML models with {} observations", history.size());

        TrainingSet trainingSet = new TrainingSet(history, featureExtractor.toRegressionSamples(history));

        TrafficPatternAnalyzer analyzer = new TrafficPatternAnalyzer();
        ArimaMember arima = new ArimaMember(new ArimaModel(), analyzer);
        RegressionMember regression = new RegressionMember(
            new RegressionModel(properties.getRidgeLambda()), properties.getPolynomialDegree());
        PatternMember pattern = new PatternMember(analyzer);

        // 1. Time series
        arima.train(trainingSet);
        // 2. Regression, linear and polynomial
        regression.train(trainingSet);
        // 3. Pattern tables and congestion triggers
        pattern.train(trainingSet);

        this.state = new EnsembleState.Ready(arima, regression, pattern, history.size(), LocalDateTime.now());
        log.info("Traffic ML models ready: {}, {} congestion patterns",
            arima.getModel().getModelState(), analyzer.getCongestionPatterns().size());
    }

    public boolean isReady() {
        return state.isReady();
    }

    public TrafficPrediction predictAt(GeoArea area, LocalDateTime targetTime) {
        return predictAt(area, targetTime, null, List.of());
    }

    /**
     * Ensemble estimate for one hour under the given live conditions.
     */
    public TrafficPrediction predictAt(GeoArea area, LocalDateTime targetTime,
                                       WeatherConditions weather, List<EventFactor> events) {
        EnsembleState.Ready ready = state.ready();
        TrafficFeatures features = featureExtractor.extract(area, targetTime, weather, events);
        return blend(ready, new PredictionContext(area, targetTime, features));
    }

    /**
     * One ensemble prediction per hour from the window's start to its end, both included.
     */
    public TrafficForecast forecast(GeoArea area, TimeWindow window) {
        EnsembleState.Ready ready = state.ready();

        List<TrafficPrediction> predictions = new ArrayList<>();
        double confidenceSum = 0;
        for (LocalDateTime time = window.getEarliest(); !time.isAfter(window.getLatest()); time = time.plusHours(1)) {
            TrafficFeatures features = featureExtractor.extract(area, time);
            TrafficPrediction prediction = blend(ready, new PredictionContext(area, time, features));
            predictions.add(prediction);
            confidenceSum += prediction.getConfidence();
        }

        return new TrafficForecast(area, window, predictions, confidenceSum / predictions.size(),
            TrafficForecast.MODEL_ENSEMBLE);
    }

    public TrafficPredictionResult getDetailedPrediction(GeoArea area, LocalDateTime targetTime) {
        return getDetailedPrediction(area, targetTime, null, List.of());
    }

    /**
     * Ensemble estimate plus the factors driving it and the blended accuracy of the
     * models that measure their own error.
     */
    public TrafficPredictionResult getDetailedPrediction(GeoArea area, LocalDateTime targetTime,
                                                         WeatherConditions weather, List<EventFactor> events) {
        EnsembleState.Ready ready = state.ready();
        TrafficFeatures features = featureExtractor.extract(area, targetTime, weather, events);
        TrafficPrediction prediction = blend(ready, new PredictionContext(area, targetTime, features));

        List<ModelAccuracy> reports = new ArrayList<>();
        for (EnsembleMember member : ready.getMembers()) {
            member.getAccuracy().ifPresent(reports::add);
        }

        TrafficPredictionResult result = new TrafficPredictionResult();
        result.setPredictions(List.of(prediction));
        result.setConfidence(prediction.getConfidence());
        result.setModelUsed(TrafficForecast.MODEL_ENSEMBLE);
        result.setAccuracy(AccuracyCalculator.combine(reports));
        result.setFactors(identifyFactors(features));
        return result;
    }

    /** Accuracy per model name, for the models that report one. */
    public Map<String, ModelAccuracy> getModelPerformance() {
        EnsembleState.Ready ready = state.ready();
        Map<String, ModelAccuracy> performance = new LinkedHashMap<>();
        performance.put(EnsembleMember.ARIMA, ready.getArima().getAccuracy().orElseThrow());
        performance.put(EnsembleMember.REGRESSION, ready.getRegression().getAccuracy().orElseThrow());
        return performance;
    }

    public ArimaModelState getArimaModelState() {
        return state.ready().getArima().getModel().getModelState();
    }

    public List<CongestionPattern> getCongestionPatterns() {
        return state.ready().getPattern().getAnalyzer().getCongestionPatterns();
    }

    // ========== Blending ==========

    private TrafficPrediction blend(EnsembleState.Ready ready, PredictionContext context) {
        double levelSum = 0;
        double speedSum = 0;
        double confidenceSum = 0;
        double totalWeight = 0;

        for (EnsembleMember member : ready.getMembers()) {
            double weight = weightOf(member);
            TrafficPrediction prediction = member.predict(context);
            levelSum += prediction.getCongestionLevel().getNumericValue() * weight;
            speedSum += prediction.getAverageSpeed() * weight;
            confidenceSum += prediction.getConfidence() * weight;
            totalWeight += weight;
        }

        double level = levelSum / totalWeight;
        log.debug("Ensemble at {} for {}: level={}", context.getTargetTime(), context.getArea(), level);
        return new TrafficPrediction(
            context.getTargetTime(),
            CongestionLevel.fromValue(level),
            Math.round(speedSum / totalWeight),
            confidenceSum / totalWeight);
    }

    private void requireUsableWeights() {
        ForecastProperties.Weights weights = properties.getWeights();
        double[] values = {weights.getPattern(), weights.getRegression(), weights.getTimeSeries()};
        double total = 0;
        for (double value : values) {
            if (value < 0 || !Double.isFinite(value)) {
                throw new IllegalArgumentException("Blend weights must be finite and non-negative: pattern="
                    + weights.getPattern() + ", regression=" + weights.getRegression()
                    + ", time-series=" + weights.getTimeSeries());
            }
            total += value;
        }
        if (total <= 0) {
            throw new IllegalArgumentException("At least one blend weight must be positive");
        }
    }

    private double weightOf(EnsembleMember member) {
        ForecastProperties.Weights weights = properties.getWeights();
        switch (member.getName()) {
            case EnsembleMember.PATTERN:
                return weights.getPattern();
            case EnsembleMember.REGRESSION:
                return weights.getRegression();
            case EnsembleMember.ARIMA:
                return weights.getTimeSeries();
            default:
                throw new IllegalStateException("No weight configured for ensemble member " + member.getName());
        }
    }

    static List<PredictionFactor> identifyFactors(TrafficFeatures features) {
        List<PredictionFactor> factors = new ArrayList<>();

        int hour = features.getHourOfDay();
        if (hour >= 7 && hour <= 10) {
            factors.add(new PredictionFactor("Morning Rush Hour", 0.8, 0.9,
                "High traffic expected during morning rush hour (7-10 AM)"));
        } else if (hour >= 17 && hour <= 20) {
            factors.add(new PredictionFactor("Evening Rush Hour", 0.7, 0.9,
                "High traffic expected during evening rush hour (5-8 PM)"));
        }

        if (features.isWeekend()) {
            factors.add(new PredictionFactor("Weekend Traffic", -0.3, 0.8,
                "Lower traffic expected on weekends"));
        }

        if (features.getWeatherScore() < 0.7) {
            factors.add(new PredictionFactor("Poor Weather Conditions", 0.4, 0.7,
                "Adverse weather conditions may increase congestion"));
        }

        if (features.getEventImpactScore() > 0.5) {
            factors.add(new PredictionFactor("Special Events", features.getEventImpactScore(), 0.6,
                "Special events in the area may cause additional congestion"));
        }

        if (features.isHoliday()) {
            factors.add(new PredictionFactor("Public Holiday", -0.5, 0.8,
                "Reduced traffic expected on public holiday"));
        }

        return factors;
    }
}
