package com.easycashflows.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TimingType {
    IMMEDIATE,
    SCHEDULE,
    DELAY;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the matching type, or {@code null} for a missing or unrecognized value
     */
    @JsonCreator
    public static TimingType fromWire(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim();
        for (TimingType type : values()) {
            if (type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return null;
    }
}
