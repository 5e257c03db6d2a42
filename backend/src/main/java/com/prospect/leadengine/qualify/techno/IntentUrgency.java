package com.prospect.leadengine.qualify.techno;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IntentUrgency {
    HIGH(50),
    MEDIUM(30),
    LOW(0);

    private final int threshold;

    IntentUrgency(int threshold) {
        this.threshold = threshold;
    }

    public static IntentUrgency fromScore(int score) {
        for (IntentUrgency urgency : values()) {
            if (score >= urgency.threshold) {
                return urgency;
            }
        }
        return LOW;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
