package com.herzen.cat.irt;

import java.time.Instant;

public class IrtModels {
    /**
     * 3PL item parameters: difficulty {@code b}, discrimination {@code a > 0}, guessing {@code c} in [0,1).
     * Range checks happen when items enter the bank, not here.
     */
    public record ItemParameter(double difficulty, double discrimination, double guessing) {
        public static ItemParameter of(double difficulty) {
            return new ItemParameter(difficulty, 1.0, 0.2);
        }
    }

    public enum EstimationMethod { PRIOR, MLE, BAYES_MODAL, FIXED_STEP }

    public record AbilityEstimate(double theta, double standardError, EstimationMethod method, Instant timestamp) {
        public static AbilityEstimate prior(double theta, double standardError) {
            return new AbilityEstimate(theta, standardError, EstimationMethod.PRIOR, Instant.now());
        }

        public double information() {
            return standardError <= 0 ? 0.0 : 1.0 / (standardError * standardError);
        }
    }

    public record ResponseObservation(ItemParameter parameter, boolean correct) {}

    public enum Outcome { CONVERGED, FALLBACK_USED, PRIOR_RETAINED }

    public record EstimationResult(AbilityEstimate estimate, Outcome outcome, int iterations) {
        public boolean fallbackUsed() {
            return outcome == Outcome.FALLBACK_USED;
        }
    }
}
