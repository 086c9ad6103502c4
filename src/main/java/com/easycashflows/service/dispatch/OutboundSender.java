package com.easycashflows.service.dispatch;

import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.Provider;

/**
 * Wire adapter for one provider. Implementations translate transport failures into
 * {@link DispatchResult#failed(String)} and throw {@link ProviderOperationNotSupportedException}
 * for operations the provider integration does not offer.
 */
public interface OutboundSender {

    Provider provider();

    boolean supports(Channel channel);

    DispatchResult send(Channel channel, String recipient, String text);
}
