package com.code.quality.core.model;

/**
 * Severity of an issue, with the weight used by aggregate quality metrics.
 */
public enum Severity {
    CRITICAL(10.0),
    HIGH(5.0),
    MEDIUM(2.0),
    LOW(1.0),
    INFO(0.5);

    private final double weight;

    Severity(double weight) {
        this.weight = weight;
    }

    public double getWeight() {
        return weight;
    }
}
