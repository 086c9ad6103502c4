package com.easycashflows.service.dispatch;

import com.easycashflows.config.ProviderCredential;
import com.easycashflows.config.WebhookProperties;
import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.Provider;
import com.easycashflows.util.WebhookText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Twilio Messages API. WhatsApp addresses carry the {@code whatsapp:} prefix on both ends.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TwilioSender implements OutboundSender {

    private static final String WHATSAPP_PREFIX = "whatsapp:";

    private final WebhookProperties properties;
    private final RestClient twilioRestClient;

    @Override
    public Provider provider() {
        return Provider.TWILIO;
    }

    @Override
    public boolean supports(Channel channel) {
        return channel == Channel.WHATSAPP || channel == Channel.SMS;
    }

    @Override
    public DispatchResult send(Channel channel, String recipient, String text) {
        ProviderCredential credential = properties.credentialFor(Provider.TWILIO);
        if (!properties.twilio().isConfigured()) {
            return DispatchResult.failed("Twilio credentials not configured");
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("From", address(channel, credential.senderAddress()));
        form.add("To", address(channel, recipient));
        form.add("Body", text);

        try {
            Map<?, ?> response = twilioRestClient.post()
                    .uri("/2010-04-01/Accounts/{sid}/Messages.json", credential.accountId())
                    .headers(h -> h.setBasicAuth(credential.accountId(), credential.secret()))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(Map.class);
            Object sid = response == null ? null : response.get("sid");
            return DispatchResult.sent(sid == null ? null : sid.toString());
        } catch (RestClientException e) {
            log.warn("Twilio send failed. channel={}, to={}, error={}", channel, WebhookText.mask(recipient), e.getMessage());
            return DispatchResult.failed(e.getMessage());
        }
    }

    private String address(Channel channel, String number) {
        String plain = WebhookText.stripWhatsAppPrefix(number);
        return channel == Channel.WHATSAPP ? WHATSAPP_PREFIX + plain : plain;
    }
}
