package com.easycashflows.service;

import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.message.DeliveryStatusUpdate;
import com.easycashflows.domain.message.InboundMessage;
import com.easycashflows.domain.message.WebhookEvent;
import com.easycashflows.dto.FacebookPayload;
import com.easycashflows.dto.LinkMobilityPayload;
import com.easycashflows.dto.ProviderPayload;
import com.easycashflows.dto.SendGridPayload;
import com.easycashflows.dto.SkebbyPayload;
import com.easycashflows.dto.TwilioPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.easycashflows.util.WebhookText.hasText;
import static com.easycashflows.util.WebhookText.stripWhatsAppPrefix;

/**
 * Maps each provider payload onto {@link InboundMessage} or {@link DeliveryStatusUpdate}.
 * A payload carrying a delivery status always takes the status path, even when it also has a body.
 * Payloads missing required fields produce no events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboundMessageNormalizer {

    private static final Pattern EMAIL_IN_BRACKETS = Pattern.compile("<([^<>\\s]+@[^<>\\s]+)>");
    private static final Pattern MESSAGE_ID_HEADER = Pattern.compile("(?im)^Message-ID:\\s*(<[^>]+>)");
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");

    private final Clock clock;

    public List<WebhookEvent> normalize(ProviderPayload payload) {
        if (payload instanceof TwilioPayload twilio) {
            return fromTwilio(twilio);
        }
        if (payload instanceof LinkMobilityPayload linkMobility) {
            return fromLinkMobility(linkMobility);
        }
        if (payload instanceof SkebbyPayload skebby) {
            return fromSkebby(skebby);
        }
        if (payload instanceof SendGridPayload sendGrid) {
            return fromSendGrid(sendGrid);
        }
        if (payload instanceof FacebookPayload facebook) {
            return fromFacebook(facebook);
        }
        return List.of();
    }

    private List<WebhookEvent> fromTwilio(TwilioPayload payload) {
        if (hasText(payload.smsStatus())) {
            if (!hasText(payload.messageSid())) {
                return skip(Provider.TWILIO, "status without MessageSid");
            }
            return List.of(status(Provider.TWILIO, payload.messageSid(), payload.smsStatus(), null));
        }
        if (!hasText(payload.body()) || !hasText(payload.from()) || !hasText(payload.messageSid())) {
            return skip(Provider.TWILIO, "missing Body/From/MessageSid");
        }
        Channel channel = payload.from().trim().startsWith("whatsapp:") ? Channel.WHATSAPP : Channel.SMS;
        return List.of(message(new InboundMessage(
                stripWhatsAppPrefix(payload.from()),
                stripWhatsAppPrefix(payload.to()),
                payload.body(),
                channel,
                Provider.TWILIO,
                payload.messageSid(),
                clock.instant(),
                null)));
    }

    private List<WebhookEvent> fromLinkMobility(LinkMobilityPayload payload) {
        Instant receivedAt = parseTimestamp(payload.timestamp());
        if (hasText(payload.status())) {
            if (!hasText(payload.messageId())) {
                return skip(Provider.LINKMOBILITY, "status without messageId");
            }
            return List.of(status(Provider.LINKMOBILITY, payload.messageId(), payload.status(), receivedAt));
        }
        if (!hasText(payload.message()) || !hasText(payload.sender())) {
            return skip(Provider.LINKMOBILITY, "missing message/sender");
        }
        String messageId = hasText(payload.messageId())
                ? payload.messageId()
                : syntheticId(Provider.LINKMOBILITY, payload.sender(), payload.timestamp(), payload.message());
        return List.of(message(new InboundMessage(
                payload.sender(),
                payload.recipient(),
                payload.message(),
                Channel.WHATSAPP,
                Provider.LINKMOBILITY,
                messageId,
                receivedAt,
                null)));
    }

    private List<WebhookEvent> fromSkebby(SkebbyPayload payload) {
        Instant receivedAt = parseTimestamp(payload.timestamp());
        if (hasText(payload.status())) {
            if (!hasText(payload.orderId())) {
                return skip(Provider.SKEBBY, "status without orderId");
            }
            return List.of(status(Provider.SKEBBY, payload.orderId(), payload.status(), receivedAt));
        }
        if (!hasText(payload.phone()) || !hasText(payload.message())) {
            return skip(Provider.SKEBBY, "missing phone/message");
        }
        String messageId = hasText(payload.orderId())
                ? payload.orderId()
                : syntheticId(Provider.SKEBBY, payload.phone(), payload.timestamp(), payload.message());
        return List.of(message(new InboundMessage(
                payload.phone(),
                payload.recipient(),
                payload.message(),
                Channel.SMS,
                Provider.SKEBBY,
                messageId,
                receivedAt,
                null)));
    }

    private List<WebhookEvent> fromSendGrid(SendGridPayload payload) {
        String body = hasText(payload.text()) ? payload.text() : htmlToText(payload.html());
        if (!hasText(payload.from()) || !hasText(body)) {
            return skip(Provider.SENDGRID, "missing from/text");
        }
        String from = extractEmail(payload.from());
        String messageId = extractMessageId(payload.headers());
        if (messageId == null) {
            messageId = syntheticId(Provider.SENDGRID, from, payload.timestamp(), payload.subject() + "|" + body);
        }
        return List.of(message(new InboundMessage(
                from,
                extractEmail(payload.to()),
                body.trim(),
                Channel.EMAIL,
                Provider.SENDGRID,
                messageId,
                parseTimestamp(payload.timestamp()),
                payload.subject())));
    }

    private List<WebhookEvent> fromFacebook(FacebookPayload payload) {
        if (!"page".equals(payload.object()) || payload.entry() == null) {
            return skip(Provider.FACEBOOK, "object is not a page subscription");
        }
        List<WebhookEvent> events = new ArrayList<>();
        for (FacebookPayload.Entry entry : payload.entry()) {
            if (entry == null || entry.messaging() == null) {
                continue;
            }
            for (FacebookPayload.Messaging messaging : entry.messaging()) {
                events.addAll(fromMessaging(messaging));
            }
        }
        return events;
    }

    private List<WebhookEvent> fromMessaging(FacebookPayload.Messaging messaging) {
        if (messaging == null) {
            return List.of();
        }
        Instant reportedAt = messaging.timestamp() == null ? clock.instant() : Instant.ofEpochMilli(messaging.timestamp());
        if (messaging.delivery() != null) {
            List<String> mids = messaging.delivery().mids() == null ? List.of() : messaging.delivery().mids();
            return mids.stream()
                    .filter(mid -> hasText(mid))
                    .map(mid -> status(Provider.FACEBOOK, mid, "delivered", reportedAt))
                    .toList();
        }
        FacebookPayload.Message message = messaging.message();
        if (message == null || Boolean.TRUE.equals(message.is_echo())) {
            return List.of();
        }
        if (messaging.sender() == null || !hasText(messaging.sender().id())
                || !hasText(message.mid()) || !hasText(message.text())) {
            return skip(Provider.FACEBOOK, "messaging event without sender/mid/text");
        }
        return List.of(message(new InboundMessage(
                messaging.sender().id(),
                messaging.recipient() == null ? null : messaging.recipient().id(),
                message.text(),
                Channel.MESSENGER,
                Provider.FACEBOOK,
                message.mid(),
                reportedAt,
                null)));
    }

    private WebhookEvent message(InboundMessage message) {
        return new WebhookEvent.MessageReceived(message);
    }

    private WebhookEvent status(Provider provider, String messageId, String status, Instant reportedAt) {
        return new WebhookEvent.StatusReported(new DeliveryStatusUpdate(
                provider, messageId, status.trim().toLowerCase(Locale.ROOT), reportedAt == null ? clock.instant() : reportedAt));
    }

    private List<WebhookEvent> skip(Provider provider, String reason) {
        log.warn("Skip {} webhook: malformed payload ({})", provider, reason);
        return List.of();
    }

    private Instant parseTimestamp(String raw) {
        if (!hasText(raw)) {
            return clock.instant();
        }
        String value = raw.trim();
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                long epoch = Long.parseLong(value);
                // seconds until the year 5138
                return epoch < 100_000_000_000L ? Instant.ofEpochSecond(epoch) : Instant.ofEpochMilli(epoch);
            }
            return OffsetDateTime.parse(value).toInstant();
        } catch (NumberFormatException | DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException ignored) {
                return clock.instant();
            }
        }
    }

    private String syntheticId(Provider provider, String from, String timestamp, String body) {
        String seed = provider.id() + "|" + from + "|" + timestamp + "|" + body;
        return "syn-" + DigestUtils.md5DigestAsHex(seed.getBytes(StandardCharsets.UTF_8));
    }

    private String extractEmail(String address) {
        if (!hasText(address)) {
            return address;
        }
        Matcher matcher = EMAIL_IN_BRACKETS.matcher(address);
        return matcher.find() ? matcher.group(1) : address.trim();
    }

    private String extractMessageId(String headers) {
        if (!hasText(headers)) {
            return null;
        }
        Matcher matcher = MESSAGE_ID_HEADER.matcher(headers);
        return matcher.find() ? matcher.group(1) : null;
    }

    private String htmlToText(String html) {
        if (!hasText(html)) {
            return null;
        }
        return HTML_TAG.matcher(html).replaceAll(" ").replaceAll("\\s+", " ").trim();
    }
}
