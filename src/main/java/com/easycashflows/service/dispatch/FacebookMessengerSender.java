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

import java.util.Map;

/**
 * Send API reply addressed by page-scoped id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FacebookMessengerSender implements OutboundSender {

    private final WebhookProperties properties;
    private final RestClient facebookRestClient;

    @Override
    public Provider provider() {
        return Provider.FACEBOOK;
    }

    @Override
    public boolean supports(Channel channel) {
        return channel == Channel.MESSENGER;
    }

    @Override
    public DispatchResult send(Channel channel, String recipient, String text) {
        WebhookProperties.Facebook facebook = properties.facebook();
        if (!facebook.isConfigured()) {
            return DispatchResult.failed("Facebook page access token not configured");
        }

        Map<String, Object> payload = Map.of(
                "recipient", Map.of("id", recipient),
                "message", Map.of("text", text),
                "messaging_type", "RESPONSE");
        try {
            Map<?, ?> response = facebookRestClient.post()
                    .uri("/me/messages")
                    .header("Authorization", "Bearer " + facebook.pageAccessToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(Map.class);
            Object messageId = response == null ? null : response.get("message_id");
            return DispatchResult.sent(messageId == null ? null : messageId.toString());
        } catch (RestClientException e) {
            log.warn("Messenger send failed. to={}, error={}", WebhookText.mask(recipient), e.getMessage());
            return DispatchResult.failed(e.getMessage());
        }
    }
}
