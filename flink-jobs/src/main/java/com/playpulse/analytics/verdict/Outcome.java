package com.playpulse.analytics.verdict;

/**
 * Three-valued result of scoring one segment occurrence, with its health-score weight.
 */
public enum Outcome {
    PASS(1.0),
    WARN(0.5),
    FAIL(0.0);

    private final double weight;

    Outcome(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }
}
