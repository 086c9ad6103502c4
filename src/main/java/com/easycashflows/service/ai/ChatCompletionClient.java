package com.easycashflows.service.ai;

/**
 * Single-shot chat completion against the AI backend.
 * Implementations throw {@link AiRateLimitedException} on HTTP 429 and {@link AiBackendException} on any other failure.
 */
public interface ChatCompletionClient {

    boolean isAvailable();

    String complete(ChatCompletionRequest request);
}
