package com.easycashflows.service;

import com.easycashflows.config.WebhookProperties;
import com.easycashflows.security.WebhookAuthenticator;
import com.easycashflows.util.WebhookText;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Endpoint inventory for operators wiring provider dashboards.
 */
@Service
@RequiredArgsConstructor
public class WebhookCatalogService {

    static final String TWILIO_PATH = "/webhooks/twilio/whatsapp";
    static final String LINKMOBILITY_PATH = "/webhooks/linkmobility/whatsapp";
    static final String STATUS_PATH = "/webhooks/whatsapp/status";
    static final String SKEBBY_PATH = "/webhooks/skebby/sms";
    static final String SENDGRID_PATH = "/webhooks/sendgrid/inbound";
    static final String FACEBOOK_PATH = "/webhooks/facebook/messenger";

    private final WebhookProperties properties;
    private final WebhookAuthenticator webhookAuthenticator;
    private final Clock clock;

    public Map<String, Object> status() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("message", "Webhook system operational");
        out.put("timestamp", Instant.now(clock).toString());
        out.put("endpoints", List.of(TWILIO_PATH, LINKMOBILITY_PATH, STATUS_PATH, SKEBBY_PATH, SENDGRID_PATH,
                FACEBOOK_PATH));
        return out;
    }

    /**
     * @param requestBaseUrl base URL of the current request, used when no public base URL is configured
     */
    public Map<String, Object> info(String requestBaseUrl) {
        String baseUrl = trimTrailingSlash(WebhookText.hasText(properties.publicBaseUrl())
                ? properties.publicBaseUrl()
                : requestBaseUrl);

        Map<String, Object> urls = new LinkedHashMap<>();
        urls.put("twilio", Map.of(
                "incoming", baseUrl + TWILIO_PATH,
                "status", baseUrl + STATUS_PATH,
                "headers", Map.of("x-provider", "twilio"),
                "signatureHeader", "X-Twilio-Signature"));
        urls.put("linkmobility", Map.of(
                "incoming", baseUrl + LINKMOBILITY_PATH,
                "status", baseUrl + STATUS_PATH,
                "headers", Map.of("x-provider", "linkmobility"),
                "signatureHeader", "X-Link-Signature"));
        urls.put("skebby", Map.of("incoming", baseUrl + SKEBBY_PATH));
        urls.put("sendgrid", Map.of("incoming", baseUrl + SENDGRID_PATH));
        urls.put("facebook", Map.of(
                "incoming", baseUrl + FACEBOOK_PATH,
                "verification", "GET " + baseUrl + FACEBOOK_PATH,
                "signatureHeader", "X-Hub-Signature-256"));

        Map<String, Object> security = new LinkedHashMap<>();
        security.put("production", webhookAuthenticator.isEnforcing());
        security.put("signatureValidation", webhookAuthenticator.isEnforcing() ? "enforced" : "disabled");
        security.put("supportedMethods", List.of("POST"));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("webhookUrls", urls);
        out.put("security", security);
        return out;
    }

    private String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
