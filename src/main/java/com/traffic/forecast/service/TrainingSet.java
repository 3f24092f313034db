package com.traffic.forecast.service;

import com.traffic.forecast.model.RegressionSample;
import com.traffic.forecast.model.TrafficObservation;

import java.util.List;

/** The history in both shapes the members train on. */
public class TrainingSet {
    private final List<TrafficObservation> observations;
    private final List<RegressionSample> regressionSamples;

    public TrainingSet(List<TrafficObservation> observations, List<RegressionSample> regressionSamples) {
        this.observations = List.copyOf(observations);
        this.regressionSamples = List.copyOf(regressionSamples);
    }

    public List<TrafficObservation> getObservations() { return observations; }
    public List<RegressionSample> getRegressionSamples() { return regressionSamples; }

    public int size() {
        return observations.size();
    }
}
