package com.herzen.cat.irt;

import com.herzen.cat.irt.IrtModels.ItemParameter;
import org.springframework.stereotype.Component;

@Component
public class ProbabilityModel {
    public static final double D = 1.7;

    private static final double EXPONENT_LIMIT = 35.0;
    private static final double P_FLOOR = 1e-9;

    public double probabilityCorrect(ItemParameter parameter, double theta) {
        double c = parameter.guessing();
        double z = clamp(-D * parameter.discrimination() * (theta - parameter.difficulty()), -EXPONENT_LIMIT, EXPONENT_LIMIT);
        return c + (1 - c) / (1 + Math.exp(z));
    }

    public double fisherInformation(ItemParameter parameter, double theta) {
        double c = parameter.guessing();
        if (1 - c <= 0) return 0.0;
        double p = boundedProbability(parameter, theta);
        double q = 1 - p;
        double da = D * parameter.discrimination();
        double ratio = (p - c) / (1 - c);
        return Math.max(0.0, da * da * (q / p) * ratio * ratio);
    }

    public double logLikelihoodGradient(ItemParameter parameter, double theta, boolean correct) {
        double c = parameter.guessing();
        if (1 - c <= 0) return 0.0;
        double p = boundedProbability(parameter, theta);
        double u = correct ? 1.0 : 0.0;
        return D * parameter.discrimination() * (u - p) * (p - c) / (p * (1 - c));
    }

    /**
     * Second derivative of one response's log-likelihood; may be positive for a correct
     * answer far below the item difficulty because the 3PL likelihood is not concave there.
     */
    public double logLikelihoodHessian(ItemParameter parameter, double theta, boolean correct) {
        double c = parameter.guessing();
        if (1 - c <= 0) return 0.0;
        double p = boundedProbability(parameter, theta);
        double u = correct ? 1.0 : 0.0;
        double da = D * parameter.discrimination();
        return da * da * (p - c) * (1 - p) * (c * u - p * p) / (p * p * (1 - c) * (1 - c));
    }

    private double boundedProbability(ItemParameter parameter, double theta) {
        return clamp(probabilityCorrect(parameter, theta), P_FLOOR, 1 - P_FLOOR);
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
