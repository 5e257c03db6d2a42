package com.prospect.leadengine.qualify.jobchange;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertStatus {
    NEW,
    ACTIONED,
    DISMISSED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (AlertStatus status : values()) {
            if (status.value().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return status;
            }
        }
        return null;
    }
}
