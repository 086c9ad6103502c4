package com.easycashflows.config;

import com.easycashflows.domain.enums.Provider;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "app.webhooks")
public record WebhookProperties(
        String publicBaseUrl,
        Boolean enforceSignatures,
        String zone,
        Integer processingThreads,
        Integer processingQueueCapacity,
        Integer dispatchThreads,
        Integer dedupRetentionDays,
        Twilio twilio,
        LinkMobility linkmobility,
        Skebby skebby,
        SendGrid sendgrid,
        Facebook facebook
) {

    public WebhookProperties {
        twilio = twilio == null ? new Twilio(null, null, null, null) : twilio;
        linkmobility = linkmobility == null ? new LinkMobility(null, null, null) : linkmobility;
        skebby = skebby == null ? new Skebby(null, null, null, null, null) : skebby;
        sendgrid = sendgrid == null ? new SendGrid(null, null, null, null, null, null) : sendgrid;
        facebook = facebook == null ? new Facebook(null, null, null, null, null) : facebook;
    }

    public ZoneId resolveZone() {
        if (!hasText(zone)) {
            return ZoneId.of("Europe/Rome");
        }
        try {
            return ZoneId.of(zone.trim());
        } catch (Exception ignored) {
            return ZoneId.of("Europe/Rome");
        }
    }

    public ProviderCredential credentialFor(Provider provider) {
        return switch (provider) {
            case TWILIO -> new ProviderCredential(provider, twilio.accountSid(), twilio.authToken(),
                    twilio.phoneNumber(), twilio.apiBase());
            case LINKMOBILITY -> new ProviderCredential(provider, linkmobility.username(), linkmobility.apiKey(),
                    null, linkmobility.endpoint());
            case SKEBBY -> new ProviderCredential(provider, skebby.username(), skebby.password(),
                    skebby.sender(), skebby.apiBase());
            case SENDGRID -> new ProviderCredential(provider, null, sendgrid.apiKey(),
                    sendgrid.fromEmail(), sendgrid.apiBase());
            case FACEBOOK -> new ProviderCredential(provider, facebook.pageId(), facebook.pageAccessToken(),
                    null, facebook.graphBase());
        };
    }

    /**
     * Shared secret used to sign inbound webhooks, or {@code null} when the provider does not sign them.
     */
    public String signingSecretFor(Provider provider) {
        return switch (provider) {
            case TWILIO -> twilio.authToken();
            case LINKMOBILITY -> linkmobility.apiKey();
            case FACEBOOK -> facebook.appSecret();
            case SKEBBY, SENDGRID -> null;
        };
    }

    public record Twilio(String accountSid, String authToken, String phoneNumber, String apiBase) {
        public boolean isConfigured() {
            return hasText(accountSid) && hasText(authToken) && hasText(phoneNumber);
        }
    }

    public record LinkMobility(String apiKey, String username, String endpoint) {
        public boolean isConfigured() {
            return hasText(apiKey);
        }
    }

    public record Skebby(String username, String password, String apiBase, String sender, String messageType) {
        public boolean isConfigured() {
            return hasText(username) && hasText(password);
        }
    }

    public record SendGrid(String apiKey, String apiBase, String fromEmail, String fromName, String replyTo,
                           String subject) {
        public boolean isConfigured() {
            return hasText(apiKey) && hasText(fromEmail);
        }
    }

    public record Facebook(String pageAccessToken, String pageId, String verifyToken, String appSecret,
                           String graphBase) {
        public boolean isConfigured() {
            return hasText(pageAccessToken);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
