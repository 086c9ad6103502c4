package com.easycashflows.domain.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Provider {
    TWILIO("twilio"),
    LINKMOBILITY("linkmobility"),
    SKEBBY("skebby"),
    SENDGRID("sendgrid"),
    FACEBOOK("facebook");

    private final String id;

    Provider(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<Provider> fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.id.equals(normalized))
                .findFirst();
    }
}
