package com.herzen.cat.config;

import com.herzen.cat.termination.TerminationCriteria;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "cat.engine")
public class CatEngineProperties {

    private double priorTheta = -1.5;
    private double priorStandardError = 1.0;
    private double stallEpsilon = 0.01;
    private int minItemsForMastery = 5;
    private final Estimation estimation = new Estimation();
    private final DefaultCriteria defaultCriteria = new DefaultCriteria();

    public double getPriorTheta() {
        return priorTheta;
    }

    public void setPriorTheta(double priorTheta) {
        this.priorTheta = priorTheta;
    }

    public double getPriorStandardError() {
        return priorStandardError;
    }

    public void setPriorStandardError(double priorStandardError) {
        this.priorStandardError = priorStandardError;
    }

    public double getStallEpsilon() {
        return stallEpsilon;
    }

    public void setStallEpsilon(double stallEpsilon) {
        this.stallEpsilon = stallEpsilon;
    }

    public int getMinItemsForMastery() {
        return minItemsForMastery;
    }

    public void setMinItemsForMastery(int minItemsForMastery) {
        this.minItemsForMastery = minItemsForMastery;
    }

    public Estimation getEstimation() {
        return estimation;
    }

    public DefaultCriteria getDefaultCriteria() {
        return defaultCriteria;
    }

    public static class Estimation {
        private double minTheta = -4.0;
        private double maxTheta = 4.0;
        private int maxIterations = 25;
        private double convergenceEpsilon = 1e-4;
        private double maxNewtonStep = 1.0;
        private double divergenceBound = 10.0;
        private double fallbackStep = 0.5;

        public double getMinTheta() {
            return minTheta;
        }

        public void setMinTheta(double minTheta) {
            this.minTheta = minTheta;
        }

        public double getMaxTheta() {
            return maxTheta;
        }

        public void setMaxTheta(double maxTheta) {
            this.maxTheta = maxTheta;
        }

        public int getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
        }

        public double getConvergenceEpsilon() {
            return convergenceEpsilon;
        }

        public void setConvergenceEpsilon(double convergenceEpsilon) {
            this.convergenceEpsilon = convergenceEpsilon;
        }

        public double getMaxNewtonStep() {
            return maxNewtonStep;
        }

        public void setMaxNewtonStep(double maxNewtonStep) {
            this.maxNewtonStep = maxNewtonStep;
        }

        public double getDivergenceBound() {
            return divergenceBound;
        }

        public void setDivergenceBound(double divergenceBound) {
            this.divergenceBound = divergenceBound;
        }

        public double getFallbackStep() {
            return fallbackStep;
        }

        public void setFallbackStep(double fallbackStep) {
            this.fallbackStep = fallbackStep;
        }
    }

    public static class DefaultCriteria {
        private double targetStandardError = 0.3;
        private int maxItems = 25;
        private Double masteryTheta = 1.2;
        private int maxStallCount = 3;

        public double getTargetStandardError() {
            return targetStandardError;
        }

        public void setTargetStandardError(double targetStandardError) {
            this.targetStandardError = targetStandardError;
        }

        public int getMaxItems() {
            return maxItems;
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = maxItems;
        }

        public Double getMasteryTheta() {
            return masteryTheta;
        }

        public void setMasteryTheta(Double masteryTheta) {
            this.masteryTheta = masteryTheta;
        }

        public int getMaxStallCount() {
            return maxStallCount;
        }

        public void setMaxStallCount(int maxStallCount) {
            this.maxStallCount = maxStallCount;
        }

        public TerminationCriteria toCriteria() {
            return new TerminationCriteria(targetStandardError, maxItems, masteryTheta, maxStallCount);
        }
    }
}
