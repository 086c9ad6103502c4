package com.easycashflows.dto;

import com.easycashflows.domain.enums.Provider;

/**
 * Raw webhook body of one provider, typed. Only the normalizer looks inside these.
 */
public sealed interface ProviderPayload
        permits TwilioPayload, LinkMobilityPayload, SkebbyPayload, SendGridPayload, FacebookPayload {

    Provider provider();
}
