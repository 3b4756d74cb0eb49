package com.herzen.cat.irt;

import com.herzen.cat.config.CatEngineProperties;
import com.herzen.cat.irt.IrtModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
public class AbilityEstimator {
    private static final Logger log = LoggerFactory.getLogger(AbilityEstimator.class);

    private static final double MIN_CURVATURE = 1e-9;

    private final ProbabilityModel model;
    private final CatEngineProperties.Estimation settings;

    public AbilityEstimator(ProbabilityModel model, CatEngineProperties properties) {
        this.model = model;
        this.settings = properties.getEstimation();
    }

    public AbilityEstimate update(List<ResponseObservation> observations, AbilityEstimate prior) {
        return estimate(observations, prior).estimate();
    }

    public EstimationResult estimate(List<ResponseObservation> observations, AbilityEstimate prior) {
        if (observations == null || observations.isEmpty()) {
            return new EstimationResult(prior, Outcome.PRIOR_RETAINED, 0);
        }

        long correct = observations.stream().filter(ResponseObservation::correct).count();
        boolean mixed = correct > 0 && correct < observations.size();

        if (mixed) {
            NewtonRun mle = newton(observations, prior.theta(), null);
            if (mle.converged()) {
                double theta = clampTheta(mle.theta());
                double info = totalInformation(observations, theta);
                double se = info > 0 ? 1.0 / Math.sqrt(info) : prior.standardError();
                return new EstimationResult(new AbilityEstimate(theta, se, EstimationMethod.MLE, Instant.now()),
                        Outcome.CONVERGED, mle.iterations());
            }
            log.debug("MLE did not converge after {} iterations (theta={}), using Bayes modal estimate",
                    mle.iterations(), mle.theta());
        }

        double priorSe = prior.standardError() > 0 ? prior.standardError() : 1.0;
        Prior normalPrior = new Prior(prior.theta(), priorSe * priorSe);
        NewtonRun map = newton(observations, prior.theta(), normalPrior);
        if (map.converged()) {
            double theta = clampTheta(map.theta());
            double info = totalInformation(observations, theta) + 1.0 / normalPrior.variance();
            return new EstimationResult(new AbilityEstimate(theta, 1.0 / Math.sqrt(info), EstimationMethod.BAYES_MODAL, Instant.now()),
                    Outcome.FALLBACK_USED, map.iterations());
        }

        double direction = Math.signum(2.0 * correct - observations.size());
        double theta = clampTheta(prior.theta() + direction * settings.getFallbackStep());
        log.debug("Bayes modal estimate did not converge, stepping from prior {} to {}", prior.theta(), theta);
        return new EstimationResult(new AbilityEstimate(theta, prior.standardError(), EstimationMethod.FIXED_STEP, Instant.now()),
                Outcome.FALLBACK_USED, map.iterations());
    }

    public double totalInformation(List<ResponseObservation> observations, double theta) {
        return observations.stream()
                .mapToDouble(o -> model.fisherInformation(o.parameter(), theta))
                .sum();
    }

    private NewtonRun newton(List<ResponseObservation> observations, double start, Prior prior) {
        double theta = start;
        for (int i = 1; i <= settings.getMaxIterations(); i++) {
            double gradient = 0.0;
            double hessian = 0.0;
            for (ResponseObservation o : observations) {
                gradient += model.logLikelihoodGradient(o.parameter(), theta, o.correct());
                hessian += model.logLikelihoodHessian(o.parameter(), theta, o.correct());
            }
            if (prior != null) {
                gradient -= (theta - prior.mean()) / prior.variance();
                hessian -= 1.0 / prior.variance();
            }
            if (!(hessian < -MIN_CURVATURE)) {
                // not concave here: take a Fisher scoring step instead
                hessian = -totalInformation(observations, theta) - (prior == null ? 0.0 : 1.0 / prior.variance());
                if (!(hessian < -MIN_CURVATURE)) {
                    return new NewtonRun(theta, false, i);
                }
            }

            double delta = ProbabilityModel.clamp(-gradient / hessian, -settings.getMaxNewtonStep(), settings.getMaxNewtonStep());
            theta += delta;
            if (!Double.isFinite(theta) || Math.abs(theta) > settings.getDivergenceBound()) {
                return new NewtonRun(theta, false, i);
            }
            if (Math.abs(delta) < settings.getConvergenceEpsilon()) {
                return new NewtonRun(theta, true, i);
            }
        }
        return new NewtonRun(theta, false, settings.getMaxIterations());
    }

    private double clampTheta(double theta) {
        return ProbabilityModel.clamp(theta, settings.getMinTheta(), settings.getMaxTheta());
    }

    private record Prior(double mean, double variance) {}

    private record NewtonRun(double theta, boolean converged, int iterations) {}
}
