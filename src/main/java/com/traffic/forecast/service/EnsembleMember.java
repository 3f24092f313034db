package com.traffic.forecast.service;

import com.traffic.forecast.model.ModelAccuracy;
import com.traffic.forecast.model.TrafficPrediction;

import java.util.Optional;

/**
 * One model taking part in the ensemble blend.
 */
public interface EnsembleMember {

    String ARIMA = "arima";
    String REGRESSION = "regression";
    String PATTERN = "pattern";

    /** Stable name, also the key in performance reports. */
    String getName();

    void train(TrainingSet trainingSet);

    TrafficPrediction predict(PredictionContext context);

    /** Empty for members that do not measure their own error. */
    Optional<ModelAccuracy> getAccuracy();
}
