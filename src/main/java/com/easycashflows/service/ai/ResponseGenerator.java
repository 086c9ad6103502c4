package com.easycashflows.service.ai;

import com.easycashflows.config.AiProperties;
import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.message.BusinessContext;
import com.easycashflows.domain.message.InboundMessage;
import com.easycashflows.domain.message.IntentAnalysis;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Drafts the automatic reply. Drafts longer than {@link Channel#MAX_REPLY_LENGTH} are discarded, never truncated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseGenerator {

    private static final String SYSTEM_PROMPT = "Sei un assistente virtuale per EasyCashFlows, un sistema di "
            + "gestione finanziaria per PMI italiane. Rispondi sempre in italiano, in modo professionale e conciso.";

    private final ChatCompletionClient chatCompletionClient;
    private final RetryPolicy aiRetryPolicy;
    private final AiProperties aiProperties;
    private final ObjectMapper objectMapper;

    public Optional<String> generate(InboundMessage message, IntentAnalysis analysis, BusinessContext context) {
        if (!chatCompletionClient.isAvailable()) {
            return Optional.empty();
        }

        ChatCompletionRequest request = new ChatCompletionRequest(
                SYSTEM_PROMPT,
                buildPrompt(message, analysis, context),
                aiProperties.resolveGenerationTemperature(),
                100,
                false);

        String draft;
        try {
            draft = aiRetryPolicy.execute(
                    () -> chatCompletionClient.complete(request),
                    e -> e instanceof AiRateLimitedException);
        } catch (RuntimeException e) {
            log.warn("Response generation failed. messageId={}, error={}", message.messageId(), e.getMessage());
            return Optional.empty();
        }

        if (draft == null || draft.isBlank()) {
            return Optional.empty();
        }
        String reply = draft.trim();
        if (reply.length() > Channel.MAX_REPLY_LENGTH) {
            log.warn("Discarded AI draft over {} characters. messageId={}, length={}",
                    Channel.MAX_REPLY_LENGTH, message.messageId(), reply.length());
            return Optional.empty();
        }
        return Optional.of(reply);
    }

    private String buildPrompt(InboundMessage message, IntentAnalysis analysis, BusinessContext context) {
        return """
                Genera una risposta %s professionale e utile per questo messaggio cliente.

                Messaggio originale: "%s"
                Analisi: %s
                Contesto business: %s

                Linee guida per la risposta:
                - Massimo %d caratteri
                - Tono professionale ma amichevole
                - Include informazioni utili se disponibili
                - Se è una domanda tecnica, suggerisci di contattare il supporto
                - Se è urgente, garantisci una risposta rapida
                - Se riguarda pagamenti, fornisci informazioni di contatto

                Rispondi SOLO con il testo del messaggio, senza spiegazioni.
                """.formatted(message.channel().id(), message.body(), toJson(analysis), toJson(context),
                Channel.MAX_REPLY_LENGTH);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return "{}";
        }
    }
}
