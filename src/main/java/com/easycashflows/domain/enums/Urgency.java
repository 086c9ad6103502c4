package com.easycashflows.domain.enums;

import java.util.Locale;
import java.util.Optional;

public enum Urgency {
    LOW,
    MEDIUM,
    HIGH;

    public static Optional<Urgency> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
