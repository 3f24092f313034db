package com.traffic.forecast.service;

import com.traffic.forecast.exception.SingularMatrixException;
import com.traffic.forecast.model.ModelAccuracy;
import com.traffic.forecast.model.RegressionSample;
import com.traffic.forecast.model.TrafficPrediction;
import com.traffic.forecast.service.ml.RegressionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Trains both regression variants. A singular system in one of them is tolerated as long
 * as the other one fits.
 */
public class RegressionMember implements EnsembleMember {

    private static final Logger log = LoggerFactory.getLogger(RegressionMember.class);

    private final RegressionModel model;
    private final int polynomialDegree;

    public RegressionMember(RegressionModel model, int polynomialDegree) {
        this.model = model;
        this.polynomialDegree = polynomialDegree;
    }

    @Override
    public String getName() {
        return REGRESSION;
    }

    @Override
    public void train(TrainingSet trainingSet) {
        List<RegressionSample> samples = trainingSet.getRegressionSamples();

        SingularMatrixException linearFailure = null;
        try {
            model.trainLinear(samples);
        } catch (SingularMatrixException e) {
            linearFailure = e;
        }

        try {
            model.trainPolynomial(samples, polynomialDegree);
        } catch (SingularMatrixException e) {
            if (linearFailure != null) {
                e.addSuppressed(linearFailure);
                throw e;
            }
            log.warn("Polynomial regression (degree {}) could not be fitted, using linear only: {}",
                polynomialDegree, e.getMessage());
            return;
        }

        if (linearFailure != null) {
            log.warn("Linear regression could not be fitted, using polynomial only: {}", linearFailure.getMessage());
        }
    }

    @Override
    public TrafficPrediction predict(PredictionContext context) {
        return model.predict(context.getFeatures(), context.getTargetTime());
    }

    @Override
    public Optional<ModelAccuracy> getAccuracy() {
        return Optional.of(model.getModelAccuracy());
    }

    public RegressionModel getModel() {
        return model;
    }
}
