package com.prospect.leadengine.qualify.playlist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PlaylistType {
    DYNAMIC,
    STATIC;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PlaylistType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (PlaylistType candidate : values()) {
            if (candidate.value().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return candidate;
            }
        }
        return null;
    }
}
