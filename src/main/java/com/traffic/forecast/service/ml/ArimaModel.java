package com.traffic.forecast.service.ml;

import com.traffic.forecast.exception.InsufficientDataException;
import com.traffic.forecast.exception.InvalidParameterCombinationException;
import com.traffic.forecast.exception.NotTrainedException;
import com.traffic.forecast.model.ArimaModelState;
import com.traffic.forecast.model.ModelAccuracy;
import com.traffic.forecast.model.TrafficObservation;
import com.traffic.forecast.model.TrafficPrediction;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Simplified ARIMA model for an hourly congestion series.
 * <p>
 * The order (p,d,q) is chosen by grid search on AIC. Coefficients are not
 * maximum-likelihood estimates: AR terms are the sample autocorrelations at lags
 * 1..p damped by 0.8, MA terms a fixed ramp of 0.1 per lag. Both the residuals and
 * the forecasts work on deviations from the mean of the differenced series, which
 * acts as the intercept counted in the parameter total.
 */
public class ArimaModel {

    private static final Logger log = LoggerFactory.getLogger(ArimaModel.class);

    public static final int MIN_TRAINING_POINTS = 24;

    private static final int MAX_P = 3;
    private static final int MAX_D = 2;
    private static final int MAX_Q = 3;
    private static final double AR_DAMPING = 0.8;
    private static final double MA_STEP = 0.1;
    // Keeps the log-likelihood finite for perfectly fitted (e.g. constant) series
    private static final double VARIANCE_FLOOR = 1e-10;
    private static final double VALIDATION_FRACTION = 0.2;
    private static final double CONFIDENCE_DECAY_PER_HOUR = 0.05;
    private static final double MIN_CONFIDENCE = 0.1;

    private ArimaModelState modelState;
    private ModelAccuracy accuracy;

    public ArimaModelState train(List<TrafficObservation> history) {
        return train(toSeries(history));
    }

    /**
     * Fits the best ARIMA(p,d,q) with p in [0,3], d in [0,2], q in [0,3] and
     * back-tests it on the last 20% of the series.
     *
     * @throws InsufficientDataException for fewer than 24 points
     */
    public ArimaModelState train(double[] series) {
        if (series.length < MIN_TRAINING_POINTS) {
            throw new InsufficientDataException("Insufficient training data for ARIMA", MIN_TRAINING_POINTS, series.length);
        }

        ArimaModelState best = null;
        for (int p = 0; p <= MAX_P; p++) {
            for (int d = 0; d <= MAX_D; d++) {
                for (int q = 0; q <= MAX_Q; q++) {
                    ArimaModelState candidate;
                    try {
                        candidate = fit(series, p, d, q);
                    } catch (InvalidParameterCombinationException e) {
                        log.debug("Skipping ARIMA({},{},{}): {}", p, d, q, e.getMessage());
                        continue;
                    }
                    if (!Double.isFinite(candidate.getAic())) {
                        log.debug("Skipping ARIMA({},{},{}): non-finite AIC", p, d, q);
                        continue;
                    }
                    if (best == null || candidate.getAic() < best.getAic()) {
                        best = candidate;
                    }
                }
            }
        }

        if (best == null) {
            throw new InsufficientDataException("No ARIMA order could be fitted", MIN_TRAINING_POINTS, series.length);
        }

        ModelAccuracy backtested = backtest(series, best);
        this.modelState = best;
        this.accuracy = backtested;
        log.debug("Selected {} on {} points, {}", best, series.length, backtested);
        return best;
    }

    public List<TrafficPrediction> predict(List<TrafficObservation> history, int forecastHours) {
        if (history.isEmpty()) {
            throw new InsufficientDataException("No historical data provided for prediction", 1, 0);
        }
        LocalDateTime origin = history.get(history.size() - 1).getTimestamp();
        return predict(toSeries(history), origin, forecastHours);
    }

    /**
     * Forecasts {@code forecastHours} hourly steps after {@code origin}. Confidence
     * starts at the back-tested accuracy and drops 0.05 per hour, floored at 0.1.
     */
    public List<TrafficPrediction> predict(double[] series, LocalDateTime origin, int forecastHours) {
        ArimaModelState state = requireState();
        if (forecastHours < 1) {
            throw new IllegalArgumentException("Forecast horizon must be at least 1 hour: " + forecastHours);
        }
        if (series.length == 0) {
            throw new InsufficientDataException("No historical data provided for prediction", 1, 0);
        }

        double baseConfidence = accuracy.getAccuracy();
        double[] values = forecast(series, series.length, state, forecastHours);

        List<TrafficPrediction> predictions = new ArrayList<>(forecastHours);
        for (int h = 1; h <= forecastHours; h++) {
            double value = values[h - 1];
            double confidence = Math.max(MIN_CONFIDENCE, baseConfidence - (h - 1) * CONFIDENCE_DECAY_PER_HOUR);
            predictions.add(new TrafficPrediction(
                origin.plusHours(h),
                CongestionScale.toLevel(value),
                CongestionScale.estimateSpeed(value),
                Math.min(1.0, confidence)));
        }
        return predictions;
    }

    public ModelAccuracy getModelAccuracy() {
        if (accuracy == null) {
            throw new NotTrainedException("ARIMA model has not been trained yet");
        }
        return accuracy;
    }

    public ArimaModelState getModelState() {
        return requireState();
    }

    public boolean isTrained() {
        return modelState != null;
    }

    private ArimaModelState requireState() {
        if (modelState == null) {
            throw new NotTrainedException("ARIMA model has not been trained yet");
        }
        return modelState;
    }

    // ========== Fitting ==========

    ArimaModelState fit(double[] series, int p, int d, int q) {
        double[] differenced = series;
        for (int i = 0; i < d; i++) {
            differenced = difference(differenced);
        }
        if (differenced.length < Math.max(p, q) + 1) {
            throw new InvalidParameterCombinationException(
                "Only " + differenced.length + " points left after differencing " + d + " times");
        }

        double[] coefficients = estimateCoefficients(differenced, p, q);
        double[] residuals = residuals(differenced, coefficients, p, q);

        int n = residuals.length;
        double rss = 0;
        for (double r : residuals) rss += r * r;
        double variance = Math.max(rss / n, VARIANCE_FLOOR);
        double logLikelihood = -0.5 * n * (Math.log(2 * Math.PI * variance) + 1);
        int numParams = p + q + 1;

        double aic = -2 * logLikelihood + 2 * numParams;
        double bic = -2 * logLikelihood + numParams * Math.log(n);
        return new ArimaModelState(p, d, q, coefficients, residuals, aic, bic);
    }

    static double[] difference(double[] series) {
        if (series.length < 2) {
            return new double[0];
        }
        double[] out = new double[series.length - 1];
        for (int i = 1; i < series.length; i++) {
            out[i - 1] = series[i] - series[i - 1];
        }
        return out;
    }

    private static double[] estimateCoefficients(double[] series, int p, int q) {
        double[] coefficients = new double[p + q];
        for (int i = 1; i <= p; i++) {
            coefficients[i - 1] = autocorrelation(series, i) * AR_DAMPING;
        }
        for (int i = 1; i <= q; i++) {
            coefficients[p + i - 1] = MA_STEP * i;
        }
        return coefficients;
    }

    static double autocorrelation(double[] series, int lag) {
        if (lag >= series.length) return 0;
        double mean = mean(series, series.length);

        double numerator = 0;
        for (int i = 0; i < series.length - lag; i++) {
            numerator += (series[i] - mean) * (series[i + lag] - mean);
        }
        double denominator = 0;
        for (double value : series) {
            denominator += (value - mean) * (value - mean);
        }
        return denominator == 0 ? 0 : numerator / denominator;
    }

    private static double[] residuals(double[] series, double[] coefficients, int p, int q) {
        double mean = mean(series, series.length);
        int start = Math.max(p, q);
        double[] residuals = new double[series.length - start];
        int count = 0;

        for (int t = start; t < series.length; t++) {
            double predicted = mean;
            for (int i = 0; i < p; i++) {
                predicted += coefficients[i] * (series[t - i - 1] - mean);
            }
            // MA terms only see residuals computed so far
            for (int i = 0; i < q && i < count; i++) {
                predicted += coefficients[p + i] * residuals[count - i - 1];
            }
            residuals[count++] = series[t] - predicted;
        }
        return residuals;
    }

    // ========== Forecasting ==========

    /**
     * Recursive forecasts from the first {@code length} values. The AR terms run on the
     * d-times differenced series, centred on its observed mean, and each forecast change
     * is integrated back onto the last observed level. Only the returned values are
     * clamped to the congestion scale.
     */
    static double[] forecast(double[] values, int length, ArimaModelState state, int steps) {
        int d = state.getD();
        double[][] orders = new double[d + 1][];
        orders[0] = Arrays.copyOf(values, length);
        for (int k = 1; k <= d; k++) {
            orders[k] = difference(orders[k - 1]);
        }

        // last observed level, then last observed change of each order below d
        double[] last = new double[d];
        for (int k = 0; k < d; k++) {
            int size = orders[k].length;
            last[k] = size > 0 ? orders[k][size - 1] : 0;
        }

        double[] observed = orders[d];
        double mean = mean(observed, observed.length);
        double[] ar = state.getArCoefficients();
        double[] working = Arrays.copyOf(observed, observed.length + steps);
        int n = observed.length;

        double[] forecasts = new double[steps];
        for (int h = 0; h < steps; h++) {
            double next = mean;
            for (int i = 0; i < ar.length && i < n; i++) {
                next += ar[i] * (working[n - 1 - i] - mean);
            }
            working[n++] = next;

            double value = next;
            for (int k = d - 1; k >= 0; k--) {
                last[k] += value;
                value = last[k];
            }
            forecasts[h] = CongestionScale.clamp(value);
        }
        return forecasts;
    }

    /** Expanding-window one-step-ahead back-test over the last 20% of the series. */
    private static ModelAccuracy backtest(double[] series, ArimaModelState state) {
        int validationSize = (int) Math.floor(series.length * VALIDATION_FRACTION);
        if (validationSize == 0) {
            return AccuracyCalculator.defaultAccuracy();
        }
        int trainingSize = series.length - validationSize;

        double[] predicted = new double[validationSize];
        double[] actual = new double[validationSize];
        for (int i = trainingSize; i < series.length; i++) {
            predicted[i - trainingSize] = forecast(series, i, state, 1)[0];
            actual[i - trainingSize] = series[i];
        }
        return AccuracyCalculator.evaluate(actual, predicted);
    }

    private static double mean(double[] values, int length) {
        return length == 0 ? 0 : StatUtils.mean(values, 0, length);
    }

    private static double[] toSeries(List<TrafficObservation> history) {
        double[] series = new double[history.size()];
        for (int i = 0; i < series.length; i++) {
            series[i] = history.get(i).getCongestionLevel();
        }
        return series;
    }
}
