package com.easycashflows.service.ai;

import com.easycashflows.config.AiProperties;
import com.easycashflows.domain.enums.AnalysisOutcome;
import com.easycashflows.domain.enums.IntentType;
import com.easycashflows.domain.enums.Urgency;
import com.easycashflows.domain.message.BusinessContext;
import com.easycashflows.domain.message.InboundMessage;
import com.easycashflows.domain.message.IntentAnalysis;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Scores intent, urgency and confidence of an inbound message with the AI backend.
 * Never throws: an unreachable, rate-limited or incoherent backend yields a zero-confidence analysis.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentClassifier {

    private static final String SYSTEM_PROMPT = "Sei un assistente AI specializzato nell'analisi di messaggi "
            + "ricevuti da un'azienda italiana. Analizza i messaggi e determina se richiedono una risposta "
            + "automatica intelligente.";

    private final ChatCompletionClient chatCompletionClient;
    private final RetryPolicy aiRetryPolicy;
    private final AiProperties aiProperties;
    private final ObjectMapper objectMapper;

    public IntentAnalysis classify(InboundMessage message, BusinessContext context) {
        if (!chatCompletionClient.isAvailable()) {
            return IntentAnalysis.unavailable();
        }

        ChatCompletionRequest request = new ChatCompletionRequest(
                SYSTEM_PROMPT,
                buildPrompt(message, context),
                aiProperties.resolveClassificationTemperature(),
                500,
                true);

        String raw;
        try {
            raw = aiRetryPolicy.execute(
                    () -> chatCompletionClient.complete(request),
                    e -> e instanceof AiRateLimitedException);
        } catch (AiRateLimitedException e) {
            log.warn("Intent classification gave up after {} rate-limited attempts. messageId={}",
                    aiRetryPolicy.maxAttempts(), message.messageId());
            return IntentAnalysis.unavailable();
        } catch (RuntimeException e) {
            log.warn("Intent classification failed. messageId={}, error={}", message.messageId(), e.getMessage());
            return IntentAnalysis.unavailable();
        }

        IntentAnalysis analysis = parse(raw);
        log.info("Classified message. messageId={}, intent={}, confidence={}, urgency={}, outcome={}",
                message.messageId(), analysis.intent(), analysis.confidence(), analysis.urgency(), analysis.outcome());
        return analysis;
    }

    IntentAnalysis parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return IntentAnalysis.unparseable();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripJsonFence(raw));
        } catch (JsonProcessingException e) {
            log.warn("Unparseable classification output: {}", e.getOriginalMessage());
            return IntentAnalysis.unparseable();
        }
        if (root == null || !root.isObject()) {
            return IntentAnalysis.unparseable();
        }

        Optional<IntentType> intent = IntentType.parse(textOrNull(root, "intent"));
        Optional<Urgency> urgency = Urgency.parse(textOrNull(root, "urgency"));
        JsonNode shouldRespond = root.get("shouldRespond");
        JsonNode confidence = root.get("confidence");
        if (intent.isEmpty() || urgency.isEmpty()
                || shouldRespond == null || !shouldRespond.isBoolean()
                || confidence == null || !confidence.isNumber()
                || confidence.asDouble() < 0.0 || confidence.asDouble() > 1.0) {
            log.warn("Classification output outside the expected vocabulary: {}", root);
            return IntentAnalysis.unparseable();
        }

        Set<String> topics = new LinkedHashSet<>();
        JsonNode topicsNode = root.get("topics");
        if (topicsNode != null && topicsNode.isArray()) {
            topicsNode.forEach(topic -> {
                if (topic.isTextual() && !topic.asText().isBlank()) {
                    topics.add(topic.asText().trim());
                }
            });
        }

        return new IntentAnalysis(intent.get(), shouldRespond.asBoolean(), confidence.asDouble(),
                urgency.get(), topics, AnalysisOutcome.CLASSIFIED);
    }

    private String buildPrompt(InboundMessage message, BusinessContext context) {
        return """
                Analizza questo messaggio %s da un cliente e determina:
                1. L'intento del messaggio
                2. Se richiede una risposta automatica
                3. Il livello di urgenza
                4. I topic principali

                Messaggio: "%s"

                Contesto business: %s

                Rispondi in formato JSON:
                {
                  "intent": "question|support|complaint|information|urgent|payment|other",
                  "shouldRespond": boolean,
                  "confidence": number (0-1),
                  "urgency": "low|medium|high",
                  "topics": ["topic1", "topic2"],
                  "reasoning": "spiegazione breve"
                }
                """.formatted(message.channel().id(), message.body(), toJson(context));
    }

    private String toJson(BusinessContext context) {
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            return "{}";
        }
    }

    private String stripJsonFence(String input) {
        String out = input.trim();
        if (out.startsWith("```")) {
            out = out.replaceFirst("^```json", "").replaceFirst("^```", "");
            out = out.replaceFirst("```$", "").trim();
        }
        return out;
    }

    private String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isTextual()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
