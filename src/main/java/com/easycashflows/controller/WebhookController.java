package com.easycashflows.controller;

import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.message.WebhookEvent;
import com.easycashflows.dto.FacebookPayload;
import com.easycashflows.dto.LinkMobilityPayload;
import com.easycashflows.dto.ProviderPayload;
import com.easycashflows.dto.SendGridPayload;
import com.easycashflows.dto.SkebbyPayload;
import com.easycashflows.dto.TwilioPayload;
import com.easycashflows.security.RawBodyCachingFilter;
import com.easycashflows.security.WebhookAuthenticator;
import com.easycashflows.service.AiAnalyticsService;
import com.easycashflows.service.InboundMessageNormalizer;
import com.easycashflows.service.WebhookCatalogService;
import com.easycashflows.service.WebhookIngressService;
import com.easycashflows.util.WebhookText;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Provider-facing webhook endpoints. Every request that passes the signature check is
 * acknowledged at once; normalized events are processed off the request thread. Bodies arrive as
 * the raw bytes captured by {@link RawBodyCachingFilter}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/webhooks")
public class WebhookController {

    static final String EMPTY_TWIML = "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response></Response>";

    private final WebhookAuthenticator webhookAuthenticator;
    private final InboundMessageNormalizer inboundMessageNormalizer;
    private final WebhookIngressService webhookIngressService;
    private final WebhookCatalogService webhookCatalogService;
    private final AiAnalyticsService aiAnalyticsService;
    private final ObjectMapper objectMapper;

    @PostMapping("/twilio/whatsapp")
    public ResponseEntity<?> twilio(
            @RequestHeader(value = "X-Twilio-Signature", required = false) String signature,
            @RequestAttribute(name = RawBodyCachingFilter.RAW_BODY_ATTRIBUTE, required = false) byte[] body
    ) {
        if (!webhookAuthenticator.verify(Provider.TWILIO, nonNull(body), signature)) {
            return invalidSignature();
        }
        accept(Provider.TWILIO, () -> TwilioPayload.fromForm(WebhookText.parseForm(text(body))));
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_XML)
                .body(EMPTY_TWIML);
    }

    @PostMapping("/linkmobility/whatsapp")
    public ResponseEntity<?> linkMobility(
            @RequestHeader(value = "X-Link-Signature", required = false) String signature,
            @RequestAttribute(name = RawBodyCachingFilter.RAW_BODY_ATTRIBUTE, required = false) byte[] body
    ) {
        if (!webhookAuthenticator.verify(Provider.LINKMOBILITY, nonNull(body), signature)) {
            return invalidSignature();
        }
        accept(Provider.LINKMOBILITY, () -> readJson(body, LinkMobilityPayload.class));
        return success();
    }

    @PostMapping("/whatsapp/status")
    public ResponseEntity<?> whatsAppStatus(
            @RequestHeader(value = "X-Provider", required = false) String providerHeader,
            @RequestHeader(value = "X-Twilio-Signature", required = false) String twilioSignature,
            @RequestHeader(value = "X-Link-Signature", required = false) String linkSignature,
            @RequestAttribute(name = RawBodyCachingFilter.RAW_BODY_ATTRIBUTE, required = false) byte[] body
    ) {
        Provider provider = Provider.fromId(providerHeader).orElse(null);
        if (provider == Provider.TWILIO) {
            return twilio(twilioSignature, body);
        }
        if (provider == Provider.LINKMOBILITY) {
            return linkMobility(linkSignature, body);
        }
        log.warn("Rejected WhatsApp status webhook: unknown provider header. provider={}", providerHeader);
        return ResponseEntity.badRequest().body(Map.of("error", "Provider not specified"));
    }

    @PostMapping("/skebby/sms")
    public ResponseEntity<?> skebby(
            @RequestAttribute(name = RawBodyCachingFilter.RAW_BODY_ATTRIBUTE, required = false) byte[] body
    ) {
        if (!webhookAuthenticator.verify(Provider.SKEBBY, nonNull(body), null)) {
            return invalidSignature();
        }
        accept(Provider.SKEBBY, () -> readJson(body, SkebbyPayload.class));
        return success();
    }

    @PostMapping(value = "/sendgrid/inbound", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> sendGridMultipart(@RequestParam Map<String, String> fields) {
        accept(Provider.SENDGRID, () -> SendGridPayload.fromForm(fields));
        return success();
    }

    @PostMapping("/sendgrid/inbound")
    public ResponseEntity<?> sendGrid(
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
            @RequestAttribute(name = RawBodyCachingFilter.RAW_BODY_ATTRIBUTE, required = false) byte[] body
    ) {
        if (!webhookAuthenticator.verify(Provider.SENDGRID, nonNull(body), null)) {
            return invalidSignature();
        }
        boolean json = contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json");
        accept(Provider.SENDGRID, () -> json
                ? readJson(body, SendGridPayload.class)
                : SendGridPayload.fromForm(WebhookText.parseForm(text(body))));
        return success();
    }

    @GetMapping("/facebook/messenger")
    public ResponseEntity<String> facebookHandshake(
            @RequestParam(value = "hub.mode", required = false) String mode,
            @RequestParam(value = "hub.verify_token", required = false) String verifyToken,
            @RequestParam(value = "hub.challenge", required = false) String challenge
    ) {
        return webhookAuthenticator.verifySubscription(mode, verifyToken, challenge)
                .map(echo -> ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(echo))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.FORBIDDEN).build());
    }

    @PostMapping("/facebook/messenger")
    public ResponseEntity<?> facebook(
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestAttribute(name = RawBodyCachingFilter.RAW_BODY_ATTRIBUTE, required = false) byte[] body
    ) {
        if (!webhookAuthenticator.verify(Provider.FACEBOOK, nonNull(body), signature)) {
            return invalidSignature();
        }
        accept(Provider.FACEBOOK, () -> readJson(body, FacebookPayload.class));
        return success();
    }

    @GetMapping("/test")
    public Map<String, Object> test() {
        return webhookCatalogService.status();
    }

    @GetMapping("/ai/analytics")
    public AiAnalyticsService.AiAnalytics aiAnalytics() {
        return aiAnalyticsService.summary();
    }

    @GetMapping("/info")
    public Map<String, Object> info() {
        return webhookCatalogService.info(ServletUriComponentsBuilder.fromCurrentContextPath().toUriString());
    }

    private void accept(Provider provider, Supplier<ProviderPayload> parser) {
        try {
            ProviderPayload payload = parser.get();
            if (payload == null) {
                log.warn("Skip {} webhook: empty payload", provider.id());
                return;
            }
            List<WebhookEvent> events = inboundMessageNormalizer.normalize(payload);
            log.info("Accepted {} webhook. events={}", provider.id(), events.size());
            webhookIngressService.submit(events);
        } catch (MalformedPayloadException e) {
            log.warn("Skip {} webhook: {}", provider.id(), e.getMessage());
        } catch (Exception e) {
            log.error("Failed to accept {} webhook: {}", provider.id(), e.getMessage(), e);
        }
    }

    private <T extends ProviderPayload> T readJson(byte[] body, Class<T> type) {
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("unreadable JSON (" + e.getOriginalMessage() + ")");
        } catch (IOException e) {
            throw new MalformedPayloadException("unreadable body (" + e.getMessage() + ")");
        }
    }

    private ResponseEntity<Map<String, String>> invalidSignature() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", "Invalid signature"));
    }

    private ResponseEntity<Map<String, Boolean>> success() {
        return ResponseEntity.ok(Map.of("success", true));
    }

    private static byte[] nonNull(byte[] body) {
        return body == null ? new byte[0] : body;
    }

    private static String text(byte[] body) {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    static class MalformedPayloadException extends RuntimeException {
        MalformedPayloadException(String message) {
            super(message);
        }
    }
}
