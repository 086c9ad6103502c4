package com.easycashflows.service.dispatch;

import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.Provider;
import org.springframework.stereotype.Component;

/**
 * LinkMobility is wired for inbound webhooks only; outbound messaging has no integration yet.
 */
@Component
public class LinkMobilitySender implements OutboundSender {

    @Override
    public Provider provider() {
        return Provider.LINKMOBILITY;
    }

    @Override
    public boolean supports(Channel channel) {
        return channel == Channel.WHATSAPP;
    }

    @Override
    public DispatchResult send(Channel channel, String recipient, String text) {
        throw new ProviderOperationNotSupportedException(Provider.LINKMOBILITY, "Outbound " + channel.id() + " send");
    }
}
