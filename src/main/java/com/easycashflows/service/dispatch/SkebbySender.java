package com.easycashflows.service.dispatch;

import com.easycashflows.config.WebhookProperties;
import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.Provider;
import com.easycashflows.util.WebhookText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Skebby REST v1.0: {@code GET login} yields {@code user_key;session_key}, then {@code POST sms}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SkebbySender implements OutboundSender {

    private static final String DEFAULT_MESSAGE_TYPE = "GP";

    private final WebhookProperties properties;
    private final RestClient skebbyRestClient;

    @Override
    public Provider provider() {
        return Provider.SKEBBY;
    }

    @Override
    public boolean supports(Channel channel) {
        return channel == Channel.SMS;
    }

    @Override
    public DispatchResult send(Channel channel, String recipient, String text) {
        WebhookProperties.Skebby skebby = properties.skebby();
        if (!skebby.isConfigured()) {
            return DispatchResult.failed("Skebby credentials not configured");
        }

        try {
            String[] session = login(skebby);
            if (session == null) {
                return DispatchResult.failed("Skebby login returned no session");
            }

            Map<String, Object> payload = new HashMap<>();
            payload.put("message_type", WebhookText.hasText(skebby.messageType()) ? skebby.messageType() : DEFAULT_MESSAGE_TYPE);
            payload.put("message", text);
            payload.put("recipient", List.of(formatNumber(recipient)));
            payload.put("returnCredits", false);
            if (WebhookText.hasText(skebby.sender())) {
                payload.put("sender", skebby.sender());
            }

            Map<?, ?> response = skebbyRestClient.post()
                    .uri("sms")
                    .header("user_key", session[0])
                    .header("Session_key", session[1])
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(Map.class);
            if (response == null || !"OK".equals(response.get("result"))) {
                Object error = response == null ? null : response.get("error");
                return DispatchResult.failed("Skebby API error: " + (error == null ? "unknown" : error));
            }
            Object orderId = response.get("order_id");
            return DispatchResult.sent(orderId == null ? null : orderId.toString());
        } catch (RestClientException e) {
            log.warn("Skebby send failed. to={}, error={}", WebhookText.mask(recipient), e.getMessage());
            return DispatchResult.failed(e.getMessage());
        }
    }

    private String[] login(WebhookProperties.Skebby skebby) {
        String raw = skebbyRestClient.get()
                .uri(uri -> uri.path("login")
                        .queryParam("username", skebby.username())
                        .queryParam("password", skebby.password())
                        .build())
                .retrieve()
                .body(String.class);
        if (raw == null) {
            return null;
        }
        String[] parts = raw.trim().split(";");
        if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
            return null;
        }
        return new String[]{parts[0], parts[1]};
    }

    static String formatNumber(String number) {
        String digits = number.replaceAll("\\D", "");
        if (digits.startsWith("00") && !number.trim().startsWith("+")) {
            return digits;
        }
        if (digits.length() == 10 && digits.startsWith("3")) {
            return "+39" + digits;
        }
        return "+" + digits;
    }
}
