package com.easycashflows.domain.message;

import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.Provider;

public record OutboundResponse(
        Provider provider,
        Channel channel,
        String recipient,
        String text,
        String sourceMessageId
) {

    public static OutboundResponse replyTo(InboundMessage message, String text) {
        return new OutboundResponse(message.provider(), message.channel(), message.from(), text, message.messageId());
    }
}
