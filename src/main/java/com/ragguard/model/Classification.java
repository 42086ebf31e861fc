package com.ragguard.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Sensitivity tag of a document
 */
public enum Classification {

    PUBLIC,
    INTERNAL,
    CONFIDENTIAL,
    RESTRICTED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Classification> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (Classification classification : values()) {
            if (classification.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(classification);
            }
        }
        return Optional.empty();
    }
}
