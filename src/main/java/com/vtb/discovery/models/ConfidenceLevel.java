package com.vtb.discovery.models;

/**
 * Грубая шкала уверенности, выводимая из непрерывного confidence score
 */
public enum ConfidenceLevel {
    HIGH(0.9),
    MEDIUM(0.7),
    LOW(0.5),
    VERY_LOW(0.0);

    private final double threshold;

    ConfidenceLevel(double threshold) {
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    public static ConfidenceLevel fromScore(double score) {
        if (score >= HIGH.threshold) {
            return HIGH;
        }
        if (score >= MEDIUM.threshold) {
            return MEDIUM;
        }
        if (score >= LOW.threshold) {
            return LOW;
        }
        return VERY_LOW;
    }
}
