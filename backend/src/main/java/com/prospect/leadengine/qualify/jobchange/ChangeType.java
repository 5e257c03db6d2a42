package com.prospect.leadengine.qualify.jobchange;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

public enum ChangeType {
    COMPANY,
    ROLE,
    BOTH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChangeType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (ChangeType type : values()) {
            if (type.value().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        return null;
    }

    /**
     * Compares freshly observed values with the stored current ones. A missing observation never counts as a change.
     */
    public static Optional<ChangeType> between(
        String currentCompany,
        String observedCompany,
        String currentRole,
        String observedRole
    ) {
        boolean companyChanged = hasText(observedCompany) && !Objects.equals(observedCompany, currentCompany);
        boolean roleChanged = hasText(observedRole) && !Objects.equals(observedRole, currentRole);
        if (companyChanged && roleChanged) {
            return Optional.of(BOTH);
        }
        if (companyChanged) {
            return Optional.of(COMPANY);
        }
        if (roleChanged) {
            return Optional.of(ROLE);
        }
        return Optional.empty();
    }

    public boolean companyChanged() {
        return this == COMPANY || this == BOTH;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
