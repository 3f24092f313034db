package com.traffic.forecast.service;

import com.traffic.forecast.model.ModelAccuracy;
import com.traffic.forecast.model.TrafficObservation;
import com.traffic.forecast.model.TrafficPrediction;
import com.traffic.forecast.service.ml.TrafficPatternAnalyzer;

import java.util.List;
import java.util.Optional;

public class PatternMember implements EnsembleMember {

    private final TrafficPatternAnalyzer analyzer;

    public PatternMember(TrafficPatternAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public String getName() {
        return PATTERN;
    }

    @Override
    public void train(TrainingSet trainingSet) {
        List<TrafficObservation> history = trainingSet.getObservations();
        analyzer.analyzeHourly(history);
        analyzer.analyzeDayOfWeek(history);
        analyzer.analyzeSeasonal(history);
        analyzer.detectCongestionPatterns(history);
    }

    @Override
    public TrafficPrediction predict(PredictionContext context) {
        return analyzer.predictBasedOnPatterns(context.getArea(), context.getTargetTime());
    }

    @Override
    public Optional<ModelAccuracy> getAccuracy() {
        return Optional.empty();
    }

    public TrafficPatternAnalyzer getAnalyzer() {
        return analyzer;
    }
}
