package com.easycashflows.service.dispatch;

import com.easycashflows.domain.enums.Provider;

public class ProviderOperationNotSupportedException extends RuntimeException {

    private final Provider provider;

    public ProviderOperationNotSupportedException(Provider provider, String operation) {
        super(operation + " is not yet supported for provider " + provider.id());
        this.provider = provider;
    }

    public Provider provider() {
        return provider;
    }
}
