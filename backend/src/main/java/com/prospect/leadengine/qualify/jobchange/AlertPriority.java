package com.prospect.leadengine.qualify.jobchange;

public enum AlertPriority {
    HIGH(80.0),
    MEDIUM(65.0),
    LOW(0.0);

    private final double threshold;

    AlertPriority(double threshold) {
        this.threshold = threshold;
    }

    public static AlertPriority fromScore(double score) {
        if (score >= HIGH.threshold) {
            return HIGH;
        }
        if (score >= MEDIUM.threshold) {
            return MEDIUM;
        }
        return LOW;
    }
}
