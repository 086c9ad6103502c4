package com.easycashflows.domain.enums;

import java.util.Locale;

public enum Channel {
    WHATSAPP,
    SMS,
    EMAIL,
    MESSENGER;

    public static final int MAX_REPLY_LENGTH = 160;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
