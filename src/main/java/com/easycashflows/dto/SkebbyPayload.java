package com.easycashflows.dto;

import com.easycashflows.domain.enums.Provider;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SkebbyPayload(
        String phone,
        String message,
        String timestamp,
        String status,
        String orderId,
        String recipient
) implements ProviderPayload {

    @Override
    public Provider provider() {
        return Provider.SKEBBY;
    }
}
