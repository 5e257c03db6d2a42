package com.prospect.leadengine.qualify.jobchange;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContactStatus {
    ACTIVE,
    INACTIVE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ContactStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        return "inactive".equalsIgnoreCase(raw.trim()) ? INACTIVE : ACTIVE;
    }
}
