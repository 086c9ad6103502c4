package com.easycashflows.domain.enums;

import java.util.Locale;
import java.util.Optional;

public enum ConditionOperator {
    GT,
    LT,
    EQ,
    GTE,
    LTE;

    public static Optional<ConditionOperator> parse(String raw) {
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
