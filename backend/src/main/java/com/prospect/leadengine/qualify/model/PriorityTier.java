package com.prospect.leadengine.qualify.model;

public enum PriorityTier {
    HOT,
    WARM,
    COOL,
    COLD;

    public static PriorityTier fromScore(double score) {
        if (score >= 80) {
            return HOT;
        }
        if (score >= 60) {
            return WARM;
        }
        if (score >= 40) {
            return COOL;
        }
        return COLD;
    }
}
