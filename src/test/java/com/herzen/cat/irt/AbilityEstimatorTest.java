package com.herzen.cat.irt;

import com.herzen.cat.config.CatEngineProperties;
import com.herzen.cat.irt.IrtModels.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AbilityEstimatorTest {
    private final ProbabilityModel model = new ProbabilityModel();
    private final AbilityEstimator estimator = new AbilityEstimator(model, new CatEngineProperties());
    private final AbilityEstimate prior = AbilityEstimate.prior(-1.5, 1.0);

    @Test
    void keepsPriorWithoutResponses() {
        EstimationResult result = estimator.estimate(List.of(), prior);
        assertEquals(Outcome.PRIOR_RETAINED, result.outcome());
        assertSame(prior, result.estimate());
    }

    @Test
    void allCorrectStaysBoundedAndAbovePrior() {
        List<ResponseObservation> observations = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            observations.add(new ResponseObservation(new ItemParameter(-1.5 + 0.2 * i, 1.0, 0.2), true));
        }

        EstimationResult result = estimator.estimate(observations, prior);
        AbilityEstimate estimate = result.estimate();

        assertTrue(result.fallbackUsed());
        assertEquals(EstimationMethod.BAYES_MODAL, estimate.method());
        assertTrue(Double.isFinite(estimate.theta()));
        assertTrue(estimate.theta() > prior.theta());
        assertTrue(estimate.theta() <= 4.0);
        assertTrue(estimate.standardError() > 0 && estimate.standardError() < prior.standardError());
    }

    @Test
    void allIncorrectMovesBelowPriorWithinRange() {
        List<ResponseObservation> observations = List.of(
                new ResponseObservation(new ItemParameter(0.0, 1.0, 0.2), false),
                new ResponseObservation(new ItemParameter(0.0, 1.0, 0.2), false),
                new ResponseObservation(new ItemParameter(0.0, 1.0, 0.2), false));

        AbilityEstimate estimate = estimator.update(observations, prior);

        assertEquals(EstimationMethod.BAYES_MODAL, estimate.method());
        assertTrue(estimate.theta() < prior.theta());
        assertTrue(estimate.theta() >= -4.0);
    }

    @Test
    void mixedResponsesUseMaximumLikelihood() {
        List<ResponseObservation> observations = List.of(
                new ResponseObservation(new ItemParameter(-1.0, 1.0, 0.2), true),
                new ResponseObservation(new ItemParameter(0.0, 1.0, 0.2), false),
                new ResponseObservation(new ItemParameter(1.0, 1.5, 0.2), true),
                new ResponseObservation(new ItemParameter(0.5, 1.0, 0.1), false));

        EstimationResult result = estimator.estimate(observations, prior);
        AbilityEstimate estimate = result.estimate();

        assertEquals(Outcome.CONVERGED, result.outcome());
        assertEquals(EstimationMethod.MLE, estimate.method());
        assertTrue(result.iterations() <= 25);

        double gradient = observations.stream()
                .mapToDouble(o -> model.logLikelihoodGradient(o.parameter(), estimate.theta(), o.correct()))
                .sum();
        assertEquals(0.0, gradient, 1e-3);
        assertEquals(1.0 / Math.sqrt(estimator.totalInformation(observations, estimate.theta())), estimate.standardError(), 1e-9);
    }

    @Test
    void clampsThetaToConfiguredRange() {
        CatEngineProperties properties = new CatEngineProperties();
        properties.getEstimation().setMaxTheta(0.5);
        AbilityEstimator narrow = new AbilityEstimator(model, properties);
        List<ResponseObservation> observations = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            observations.add(new ResponseObservation(new ItemParameter(2.0, 2.0, 0.0), true));
        }

        assertEquals(0.5, narrow.update(observations, prior).theta());
    }

    @Test
    void fallsBackToFixedStepWhenNothingConverges() {
        CatEngineProperties properties = new CatEngineProperties();
        properties.getEstimation().setMaxIterations(1);
        properties.getEstimation().setConvergenceEpsilon(0.0);
        AbilityEstimator impatient = new AbilityEstimator(model, properties);

        AbilityEstimate estimate = impatient.update(
                List.of(new ResponseObservation(new ItemParameter(0.0, 1.0, 0.2), true)), prior);

        assertEquals(EstimationMethod.FIXED_STEP, estimate.method());
        assertEquals(-1.0, estimate.theta(), 1e-12);
        assertEquals(prior.standardError(), estimate.standardError());
    }

    @Test
    void informationIsInverseSquaredError() {
        assertEquals(4.0, new AbilityEstimate(0.0, 0.5, EstimationMethod.MLE, null).information(), 1e-12);
        assertEquals(0.0, new AbilityEstimate(0.0, 0.0, EstimationMethod.MLE, null).information());
    }
}
