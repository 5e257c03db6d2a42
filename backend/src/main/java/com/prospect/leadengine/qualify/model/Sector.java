package com.prospect.leadengine.qualify.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Industry sectors. Target sectors carry the sector-fit score earned by past success cases in that sector.
 */
public enum Sector {
    BANKING("banking", true, 100),
    FINTECH("fintech", true, 95),
    RETAIL("retail", true, 90),
    ECOMMERCE("ecommerce", true, 80),
    MANUFACTURING("manufacturing", true, 80),
    MINING("mining", true, 90),
    TECHNOLOGY("technology", true, 85),
    HEALTHCARE("healthcare", true, 85),
    OTHER("other", false, 40);

    public static final int TARGET_DEFAULT_FIT = 80;

    private final String value;
    private final boolean target;
    private final int fitScore;

    Sector(String value, boolean target, int fitScore) {
        this.value = value;
        this.target = target;
        this.fitScore = fitScore;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTarget() {
        return target;
    }

    public int fitScore() {
        return fitScore;
    }

    @JsonCreator
    public static Sector fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Sector sector : values()) {
            if (sector.value.equals(normalized) || sector.name().equalsIgnoreCase(normalized)) {
                return sector;
            }
        }
        return null;
    }
}
