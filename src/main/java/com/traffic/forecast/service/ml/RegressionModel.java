package com.traffic.forecast.service.ml;

import com.traffic.forecast.exception.InsufficientDataException;
import com.traffic.forecast.exception.NotTrainedException;
import com.traffic.forecast.math.LinearAlgebra;
import com.traffic.forecast.model.ModelAccuracy;
import com.traffic.forecast.model.RegressionModelState;
import com.traffic.forecast.model.RegressionSample;
import com.traffic.forecast.model.TrafficFeatures;
import com.traffic.forecast.model.TrafficPrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Feature-based congestion regression. Holds a linear fit and a polynomial fit side by
 * side; {@link #predict} prefers the polynomial one when it exists.
 */
public class RegressionModel {

    private static final Logger log = LoggerFactory.getLogger(RegressionModel.class);

    public static final int MIN_LINEAR_SAMPLES = 10;
    public static final double DEFAULT_RIDGE_LAMBDA = 0.01;

    private final double ridgeLambda;

    private RegressionModelState linearModel;
    private ModelAccuracy linearAccuracy;
    private RegressionModelState polynomialModel;
    private ModelAccuracy polynomialAccuracy;
    private int polynomialDegree = 2;

    public RegressionModel() {
        this(DEFAULT_RIDGE_LAMBDA);
    }

    public RegressionModel(double ridgeLambda) {
        if (ridgeLambda < 0) {
            throw new IllegalArgumentException("Ridge lambda must not be negative: " + ridgeLambda);
        }
        this.ridgeLambda = ridgeLambda;
    }

    /**
     * Ordinary least squares on the 10 normalized features plus a bias column.
     * Metrics are measured on the training fit itself.
     *
     * @throws InsufficientDataException for fewer than 10 samples
     * @throws com.traffic.forecast.exception.SingularMatrixException if X'X cannot be solved
     */
    public RegressionModelState trainLinear(List<RegressionSample> samples) {
        if (samples.size() < MIN_LINEAR_SAMPLES) {
            throw new InsufficientDataException("Insufficient training data for linear regression",
                MIN_LINEAR_SAMPLES, samples.size());
        }

        double[][] x = designMatrix(samples, 1);
        double[] y = targets(samples);
        double[] beta = LinearAlgebra.solveNormalEquation(x, y, 0);

        RegressionModelState state = toState(beta, x, y);
        this.linearAccuracy = AccuracyCalculator.evaluate(y, fitted(x, beta));
        this.linearModel = state;
        log.debug("Linear regression on {} samples: r2={}, mse={}", samples.size(),
            state.getRSquared(), state.getMeanSquaredError());
        return state;
    }

    /**
     * Ridge-regularized least squares on polynomial features: the base features,
     * their powers 2..degree and all pairwise products.
     *
     * @throws InsufficientDataException for fewer than {@code 2 * degree} samples
     */
    public RegressionModelState trainPolynomial(List<RegressionSample> samples, int degree) {
        if (degree < 1) {
            throw new IllegalArgumentException("Polynomial degree must be at least 1: " + degree);
        }
        if (samples.size() < degree * 2) {
            throw new InsufficientDataException("Insufficient training data for polynomial regression of degree " + degree,
                degree * 2, samples.size());
        }

        double[][] x = designMatrix(samples, degree);
        double[] y = targets(samples);
        double[] beta = LinearAlgebra.solveNormalEquation(x, y, ridgeLambda);

        RegressionModelState state = toState(beta, x, y);
        this.polynomialAccuracy = AccuracyCalculator.evaluate(y, fitted(x, beta));
        this.polynomialDegree = degree;
        this.polynomialModel = state;
        log.debug("Polynomial regression (degree {}) on {} samples: r2={}, mse={}", degree, samples.size(),
            state.getRSquared(), state.getMeanSquaredError());
        return state;
    }

    public TrafficPrediction predict(TrafficFeatures features) {
        return predict(features, LocalDateTime.now());
    }

    /**
     * Point prediction for one feature set. Confidence starts from the fit's accuracy and
     * is adjusted for weather, events and time of day.
     */
    public TrafficPrediction predict(TrafficFeatures features, LocalDateTime timestamp) {
        double raw;
        ModelAccuracy accuracy;
        if (polynomialModel != null) {
            raw = polynomialModel.evaluate(expand(features.toVector(), polynomialDegree));
            accuracy = polynomialAccuracy;
        } else if (linearModel != null) {
            raw = linearModel.evaluate(features.toVector());
            accuracy = linearAccuracy;
        } else {
            throw new NotTrainedException("No trained regression model available. Train a model first.");
        }

        double value = CongestionScale.clamp(raw);
        return new TrafficPrediction(
            timestamp,
            CongestionScale.toLevel(value),
            CongestionScale.estimateSpeed(value),
            confidence(features, accuracy.getAccuracy()));
    }

    /** Accuracy of the variant {@link #predict} would use. */
    public ModelAccuracy getModelAccuracy() {
        if (polynomialAccuracy != null) return polynomialAccuracy;
        if (linearAccuracy != null) return linearAccuracy;
        throw new NotTrainedException("No trained regression model available");
    }

    public RegressionModelState getLinearModel() { return linearModel; }
    public RegressionModelState getPolynomialModel() { return polynomialModel; }
    public int getPolynomialDegree() { return polynomialDegree; }

    public boolean isTrained() {
        return linearModel != null || polynomialModel != null;
    }

    /**
     * Polynomial expansion of a base vector. Degree 1 returns the vector unchanged.
     */
    static double[] expand(double[] base, int degree) {
        if (degree < 2) {
            return base.clone();
        }
        int n = base.length;
        int size = n * degree + n * (n - 1) / 2;
        double[] out = new double[size];
        int idx = 0;
        for (double v : base) {
            out[idx++] = v;
        }
        for (int power = 2; power <= degree; power++) {
            for (double v : base) {
                out[idx++] = Math.pow(v, power);
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                out[idx++] = base[i] * base[j];
            }
        }
        return out;
    }

    private static double confidence(TrafficFeatures features, double baseAccuracy) {
        double confidence = baseAccuracy;
        if (features.getWeatherScore() < 0.3) {
            confidence *= 0.8;
        }
        if (features.getEventImpactScore() > 0.7) {
            confidence *= 0.7;
        }
        int hour = features.getHourOfDay();
        if ((hour >= 7 && hour <= 10) || (hour >= 17 && hour <= 20)) {
            confidence *= 1.1;   // rush hours follow the most regular pattern
        } else if (hour >= 22 || hour <= 5) {
            confidence *= 0.9;
        }
        return CongestionScale.clampConfidence(confidence);
    }

    // Rows are [1, features...]
    private static double[][] designMatrix(List<RegressionSample> samples, int degree) {
        double[][] x = new double[samples.size()][];
        for (int i = 0; i < samples.size(); i++) {
            double[] features = expand(samples.get(i).getFeatures().toVector(), degree);
            double[] row = new double[features.length + 1];
            row[0] = 1;
            System.arraycopy(features, 0, row, 1, features.length);
            x[i] = row;
        }
        return x;
    }

    private static double[] targets(List<RegressionSample> samples) {
        double[] y = new double[samples.size()];
        for (int i = 0; i < y.length; i++) {
            y[i] = samples.get(i).getTarget();
        }
        return y;
    }

    private static double[] fitted(double[][] x, double[] beta) {
        return LinearAlgebra.multiply(x, beta);
    }

    private static RegressionModelState toState(double[] beta, double[][] x, double[] y) {
        double[] predicted = fitted(x, beta);
        double[] coefficients = new double[beta.length - 1];
        System.arraycopy(beta, 1, coefficients, 0, coefficients.length);
        return new RegressionModelState(
            coefficients,
            beta[0],
            AccuracyCalculator.rSquared(y, predicted),
            AccuracyCalculator.meanSquaredError(y, predicted),
            AccuracyCalculator.meanAbsoluteError(y, predicted));
    }
}
