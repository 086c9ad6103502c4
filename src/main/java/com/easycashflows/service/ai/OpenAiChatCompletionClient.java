package com.easycashflows.service.ai;

import com.easycashflows.config.AiProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiChatCompletionClient implements ChatCompletionClient {

    private final AiProperties aiProperties;
    private final RestClient aiRestClient;

    @Override
    public boolean isAvailable() {
        return aiProperties.hasApiKey();
    }

    @Override
    public String complete(ChatCompletionRequest request) {
        if (!isAvailable()) {
            throw new AiBackendException("AI backend is not configured");
        }
        Map<?, ?> response;
        try {
            response = aiRestClient.post()
                    .uri("/v1/chat/completions")
                    .header("Authorization", "Bearer " + aiProperties.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(buildPayload(request))
                    .retrieve()
                    .body(Map.class);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new AiRateLimitedException("AI backend rate limit hit", e);
            }
            throw new AiBackendException("AI backend answered " + e.getStatusCode().value(), e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new AiBackendException("AI backend unreachable: " + e.getMessage(), null, e);
        }

        String content = extractContent(response);
        if (content == null) {
            throw new AiBackendException("AI backend returned no content");
        }
        return content;
    }

    private Map<String, Object> buildPayload(ChatCompletionRequest request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", aiProperties.resolveModel());
        payload.put("messages", List.of(
                Map.of("role", "system", "content", request.systemPrompt()),
                Map.of("role", "user", "content", request.userPrompt())));
        payload.put("temperature", request.temperature());
        payload.put("max_tokens", request.maxTokens());
        if (request.jsonOutput()) {
            payload.put("response_format", Map.of("type", "json_object"));
        }
        return payload;
    }

    private String extractContent(Map<?, ?> response) {
        if (response == null) {
            return null;
        }
        Object choicesObj = response.get("choices");
        if (!(choicesObj instanceof List<?> choices) || choices.isEmpty()) {
            return null;
        }
        if (!(choices.get(0) instanceof Map<?, ?> firstChoice)) {
            return null;
        }
        if (!(firstChoice.get("message") instanceof Map<?, ?> message)) {
            return null;
        }
        return message.get("content") instanceof String content ? content : null;
    }
}
