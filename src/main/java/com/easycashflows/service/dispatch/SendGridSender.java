package com.easycashflows.service.dispatch;

import com.easycashflows.config.WebhookProperties;
import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.Provider;
import com.easycashflows.util.WebhookText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class SendGridSender implements OutboundSender {

    private static final String DEFAULT_SUBJECT = "Risposta da EasyCashFlows";

    private final WebhookProperties properties;
    private final RestClient sendGridRestClient;

    @Override
    public Provider provider() {
        return Provider.SENDGRID;
    }

    @Override
    public boolean supports(Channel channel) {
        return channel == Channel.EMAIL;
    }

    @Override
    public DispatchResult send(Channel channel, String recipient, String text) {
        WebhookProperties.SendGrid sendgrid = properties.sendgrid();
        if (!sendgrid.isConfigured()) {
            return DispatchResult.failed("SendGrid credentials not configured");
        }

        Map<String, Object> from = new HashMap<>();
        from.put("email", sendgrid.fromEmail());
        if (WebhookText.hasText(sendgrid.fromName())) {
            from.put("name", sendgrid.fromName());
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("personalizations", List.of(Map.of("to", List.of(Map.of("email", recipient)))));
        payload.put("from", from);
        payload.put("subject", WebhookText.hasText(sendgrid.subject()) ? sendgrid.subject() : DEFAULT_SUBJECT);
        payload.put("content", List.of(Map.of("type", "text/plain", "value", text)));
        if (WebhookText.hasText(sendgrid.replyTo())) {
            payload.put("reply_to", Map.of("email", sendgrid.replyTo()));
        }

        try {
            ResponseEntity<Void> response = sendGridRestClient.post()
                    .uri("/v3/mail/send")
                    .header("Authorization", "Bearer " + sendgrid.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity();
            return DispatchResult.sent(response.getHeaders().getFirst("X-Message-Id"));
        } catch (RestClientException e) {
            log.warn("SendGrid send failed. to={}, error={}", WebhookText.mask(recipient), e.getMessage());
            return DispatchResult.failed(e.getMessage());
        }
    }
}
