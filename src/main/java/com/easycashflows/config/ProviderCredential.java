package com.easycashflows.config;

import com.easycashflows.domain.enums.Provider;

/**
 * Secret bundle borrowed for a single outbound call. Never persisted, never logged.
 */
public record ProviderCredential(
        Provider provider,
        String accountId,
        String secret,
        String senderAddress,
        String endpoint
) {

    public boolean isComplete() {
        return secret != null && !secret.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderCredential[provider=" + provider + ", accountId=" + accountId + ", secret=***]";
    }
}
