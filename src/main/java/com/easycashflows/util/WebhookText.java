package com.easycashflows.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

public final class WebhookText {

    private static final String WHATSAPP_PREFIX = "whatsapp:";

    private WebhookText() {
    }

    public static Map<String, String> parseForm(String body) {
        Map<String, String> map = new LinkedHashMap<>();
        if (body == null || body.isBlank()) {
            return map;
        }
        for (String pair : body.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx <= 0) {
                continue;
            }
            String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
            map.put(key, value);
        }
        return map;
    }

    public static String stripWhatsAppPrefix(String address) {
        if (address == null) {
            return null;
        }
        String trimmed = address.trim();
        return trimmed.startsWith(WHATSAPP_PREFIX) ? trimmed.substring(WHATSAPP_PREFIX.length()) : trimmed;
    }

    /**
     * Keeps the last three characters of an address so log lines stay correlatable without exposing it.
     */
    public static String mask(String address) {
        if (address == null || address.isBlank()) {
            return "null";
        }
        if (address.length() <= 3) {
            return "***";
        }
        return "***" + address.substring(address.length() - 3);
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
