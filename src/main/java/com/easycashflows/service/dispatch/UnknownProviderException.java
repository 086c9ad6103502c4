package com.easycashflows.service.dispatch;

public class UnknownProviderException extends RuntimeException {

    public UnknownProviderException(String providerId) {
        super("Unknown provider: " + providerId);
    }
}
