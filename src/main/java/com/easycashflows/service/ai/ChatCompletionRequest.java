package com.easycashflows.service.ai;

public record ChatCompletionRequest(
        String systemPrompt,
        String userPrompt,
        double temperature,
        int maxTokens,
        boolean jsonOutput
) {
}
