package com.easycashflows.domain.message;

import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.Provider;

import java.time.Instant;
import java.util.Objects;

/**
 * Canonical form of one inbound webhook delivery, whatever provider it came from.
 * {@code subject} is only populated for email.
 */
public record InboundMessage(
        String from,
        String to,
        String body,
        Channel channel,
        Provider provider,
        String messageId,
        Instant receivedAt,
        String subject
) {

    public InboundMessage {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    public String deduplicationKey() {
        return provider.id() + ":" + messageId;
    }

    public String preview(int maxLength) {
        return body.length() <= maxLength ? body : body.substring(0, maxLength) + "...";
    }
}
