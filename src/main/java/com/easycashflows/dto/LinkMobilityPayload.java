package com.easycashflows.dto;

import com.easycashflows.domain.enums.Provider;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LinkMobilityPayload(
        String message,
        String status,
        String sender,
        String recipient,
        String timestamp,
        String messageId
) implements ProviderPayload {

    @Override
    public Provider provider() {
        return Provider.LINKMOBILITY;
    }
}
