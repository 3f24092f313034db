package com.traffic.forecast.service;

import com.traffic.forecast.model.ModelAccuracy;
import com.traffic.forecast.model.TrafficPrediction;
import com.traffic.forecast.service.ml.ArimaModel;
import com.traffic.forecast.service.ml.TrafficPatternAnalyzer;

import java.util.Optional;

/**
 * Time-series member. The ARIMA model is trained and reports its back-tested accuracy,
 * but a point prediction needs the live series leading up to the target hour, which the
 * ensemble does not have. Until it does, the pattern estimate stands in for it.
 */
public class ArimaMember implements EnsembleMember {

    private final ArimaModel model;
    private final TrafficPatternAnalyzer proxy;

    public ArimaMember(ArimaModel model, TrafficPatternAnalyzer proxy) {
        this.model = model;
        this.proxy = proxy;
    }

    @Override
    public String getName() {
        return ARIMA;
    }

    @Override
    public void train(TrainingSet trainingSet) {
        model.train(trainingSet.getObservations());
    }

    @Override
    public TrafficPrediction predict(PredictionContext context) {
        return proxy.predictBasedOnPatterns(context.getArea(), context.getTargetTime());
    }

    @Override
    public Optional<ModelAccuracy> getAccuracy() {
        return Optional.of(model.getModelAccuracy());
    }

    public ArimaModel getModel() {
        return model;
    }
}
