package com.easycashflows.service.ai;

/**
 * The AI backend answered HTTP 429. The only AI failure that is worth retrying.
 */
public class AiRateLimitedException extends AiBackendException {

    public AiRateLimitedException(String message, Throwable cause) {
        super(message, 429, cause);
    }
}
