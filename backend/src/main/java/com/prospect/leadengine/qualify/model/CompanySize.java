package com.prospect.leadengine.qualify.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CompanySize {
    MICRO("micro", 10),
    SMALL("small", 30),
    MEDIUM("medium", 60),
    LARGE("large", 90),
    ENTERPRISE("enterprise", 100);

    public static final int UNKNOWN_SCORE = 30;

    private final String value;
    private final int score;

    CompanySize(String value, int score) {
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

    public boolean isLargeAccount() {
        return this == LARGE || this == ENTERPRISE;
    }

    @JsonCreator
    public static CompanySize fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CompanySize size : values()) {
            if (size.value.equals(normalized)) {
                return size;
            }
        }
        return null;
    }
}
