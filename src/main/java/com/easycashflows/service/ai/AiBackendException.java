package com.easycashflows.service.ai;

public class AiBackendException extends RuntimeException {

    private final Integer statusCode;

    public AiBackendException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public AiBackendException(String message) {
        this(message, null, null);
    }

    public Integer statusCode() {
        return statusCode;
    }
}
