package com.traffic.forecast.service;

import com.traffic.forecast.exception.NotInitializedException;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Lifecycle of the ensemble. Predictions are only defined on {@link Ready}, which carries
 * the trained members; a new Ready replaces the old one as a whole.
 */
public interface EnsembleState {

    boolean isReady();

    /**
     * @throws NotInitializedException when no trained ensemble exists yet
     */
    Ready ready();

    static EnsembleState uninitialized() {
        return Uninitialized.INSTANCE;
    }

    final class Uninitialized implements EnsembleState {
        private static final Uninitialized INSTANCE = new Uninitialized();

        private Uninitialized() {}

        @Override
        public boolean isReady() {
            return false;
        }

        @Override
        public Ready ready() {
            throw new NotInitializedException("Traffic ML service must be initialized with historical data before use");
        }
    }

    final class Ready implements EnsembleState {
        private final ArimaMember arima;
        private final RegressionMember regression;
        private final PatternMember pattern;
        private final int trainingSize;
        private final LocalDateTime trainedAt;

        public Ready(ArimaMember arima, RegressionMember regression, PatternMember pattern,
                     int trainingSize, LocalDateTime trainedAt) {
            this.arima = arima;
            this.regression = regression;
            this.pattern = pattern;
            this.trainingSize = trainingSize;
            this.trainedAt = trainedAt;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public Ready ready() {
            return this;
        }

        /** Members in blend order: pattern, regression, time series. */
        public List<EnsembleMember> getMembers() {
            return List.of(pattern, regression, arima);
        }

        public ArimaMember getArima() { return arima; }
        public RegressionMember getRegression() { return regression; }
        public PatternMember getPattern() { return pattern; }
        public int getTrainingSize() { return trainingSize; }
        public LocalDateTime getTrainedAt() { return trainedAt; }
    }
}
