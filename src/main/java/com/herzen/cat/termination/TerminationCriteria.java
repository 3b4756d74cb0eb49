package com.herzen.cat.termination;

public record TerminationCriteria(double targetStandardError, int maxItems, Double masteryTheta, int maxStallCount) {
    public TerminationCriteria {
        if (maxItems <= 0) throw new IllegalArgumentException("maxItems must be positive: " + maxItems);
        if (maxStallCount <= 0) throw new IllegalArgumentException("maxStallCount must be positive: " + maxStallCount);
        if (targetStandardError < 0) throw new IllegalArgumentException("targetStandardError must not be negative: " + targetStandardError);
    }

    public static TerminationCriteria defaults() {
        return new TerminationCriteria(0.3, 25, 1.2, 3);
    }
}
