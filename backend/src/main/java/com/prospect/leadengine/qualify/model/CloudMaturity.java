package com.prospect.leadengine.qualify.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Cloud adoption stage. The score is used as a floor for the digital maturity factor.
 */
public enum CloudMaturity {
    NONE("none", 0),
    EXPLORING("exploring", 20),
    ADOPTING("adopting", 40),
    MATURE("mature", 60),
    NATIVE("native", 80);

    private final String value;
    private final int score;

    CloudMaturity(String value, int score) {
        this.value = value;
        this.score = score;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int score() {
        return score;
    }

    @JsonCreator
    public static CloudMaturity fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CloudMaturity maturity : values()) {
            if (maturity.value.equals(normalized)) {
                return maturity;
            }
        }
        return null;
    }
}
