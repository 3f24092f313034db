package com.traffic.forecast.service.ml;

import com.traffic.forecast.model.ModelAccuracy;

import java.util.List;

/**
 * Error metrics shared by the time-series and regression models.
 */
public final class AccuracyCalculator {

    private AccuracyCalculator() {}

    public static ModelAccuracy evaluate(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("Series lengths differ: " + actual.length + " vs " + predicted.length);
        }
        if (actual.length == 0) {
            return defaultAccuracy();
        }
        double rmse = Math.sqrt(meanSquaredError(actual, predicted));
        // Accuracy is RMSE normalized by the top of the congestion scale
        double accuracy = Math.max(0, 1 - rmse / CongestionScale.MAX_LEVEL);
        return new ModelAccuracy(mape(actual, predicted), rmse, meanAbsoluteError(actual, predicted),
            rSquared(actual, predicted), accuracy);
    }

    /** Used when there is nothing to validate against. */
    public static ModelAccuracy defaultAccuracy() {
        return new ModelAccuracy(100, 1, 1, 0, 0.5);
    }

    /**
     * Component-wise blend of several accuracy reports: RMSE as the root of the mean
     * squared RMSE, everything else as a plain mean.
     */
    public static ModelAccuracy combine(List<ModelAccuracy> reports) {
        if (reports.isEmpty()) {
            return defaultAccuracy();
        }
        double mape = 0, squaredRmse = 0, mae = 0, r2 = 0, accuracy = 0;
        for (ModelAccuracy report : reports) {
            mape += report.getMape();
            squaredRmse += report.getRmse() * report.getRmse();
            mae += report.getMae();
            r2 += report.getR2();
            accuracy += report.getAccuracy();
        }
        int n = reports.size();
        return new ModelAccuracy(mape / n, Math.sqrt(squaredRmse / n), mae / n, r2 / n, accuracy / n);
    }

    /** Mean absolute percentage error in percent; zero actuals are skipped, 100 if none remain. */
    public static double mape(double[] actual, double[] predicted) {
        double sum = 0;
        int count = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] != 0) {
                sum += Math.abs((actual[i] - predicted[i]) / actual[i]);
                count++;
            }
        }
        return count > 0 ? (sum / count) * 100 : 100;
    }

    public static double meanSquaredError(double[] actual, double[] predicted) {
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double error = actual[i] - predicted[i];
            sum += error * error;
        }
        return sum / actual.length;
    }

    public static double meanAbsoluteError(double[] actual, double[] predicted) {
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs(actual[i] - predicted[i]);
        }
        return sum / actual.length;
    }

    /** Coefficient of determination; 0 when the actuals have no variance. */
    public static double rSquared(double[] actual, double[] predicted) {
        double mean = 0;
        for (double v : actual) mean += v;
        mean /= actual.length;

        double totalSumSquares = 0;
        double residualSumSquares = 0;
        for (int i = 0; i < actual.length; i++) {
            totalSumSquares += (actual[i] - mean) * (actual[i] - mean);
            residualSumSquares += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
        }
        return totalSumSquares == 0 ? 0 : 1 - residualSumSquares / totalSumSquares;
    }
}
