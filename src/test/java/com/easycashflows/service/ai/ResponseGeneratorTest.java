package com.easycashflows.service.ai;

import com.easycashflows.config.AiProperties;
import com.easycashflows.domain.enums.AnalysisOutcome;
import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.IntentType;
import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.enums.Urgency;
import com.easycashflows.domain.message.BusinessContext;
import com.easycashflows.domain.message.InboundMessage;
import com.easycashflows.domain.message.IntentAnalysis;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResponseGenerator")
class ResponseGeneratorTest {

    @Mock
    private ChatCompletionClient chatCompletionClient;

    private ResponseGenerator generator;

    private final IntentAnalysis analysis = new IntentAnalysis(IntentType.QUESTION, true, 0.9, Urgency.LOW,
            Set.of("orari"), AnalysisOutcome.CLASSIFIED);

    @BeforeEach
    void setUp() {
        RetryPolicy retryPolicy = new RetryPolicy(3, 1000, 10000, millis -> { });
        generator = new ResponseGenerator(chatCompletionClient, retryPolicy,
                new AiProperties("key", null, null, null, null, null, null), new ObjectMapper());
        when(chatCompletionClient.isAvailable()).thenReturn(true);
    }

    @Test
    @DisplayName("Returns a trimmed draft within the length ceiling")
    void returnsShortDraft() {
        when(chatCompletionClient.complete(any())).thenReturn("  Siamo aperti dal lunedì al venerdì, 9-18.  ");

        Optional<String> reply = generator.generate(message(), analysis, BusinessContext.empty());

        assertThat(reply).contains("Siamo aperti dal lunedì al venerdì, 9-18.");
    }

    @Test
    @DisplayName("Rejects a draft longer than 160 characters instead of truncating it")
    void rejectsLongDraft() {
        when(chatCompletionClient.complete(any())).thenReturn("x".repeat(Channel.MAX_REPLY_LENGTH + 1));

        assertThat(generator.generate(message(), analysis, BusinessContext.empty())).isEmpty();
    }

    @Test
    @DisplayName("Accepts a draft of exactly 160 characters")
    void acceptsDraftAtLimit() {
        when(chatCompletionClient.complete(any())).thenReturn("x".repeat(Channel.MAX_REPLY_LENGTH));

        assertThat(generator.generate(message(), analysis, BusinessContext.empty())).isPresent();
    }

    @Test
    @DisplayName("Blank drafts and backend failures produce no reply")
    void noReplyOnBlankOrFailure() {
        when(chatCompletionClient.complete(any()))
                .thenReturn("   ")
                .thenThrow(new AiBackendException("down"));

        assertThat(generator.generate(message(), analysis, BusinessContext.empty())).isEmpty();
        assertThat(generator.generate(message(), analysis, BusinessContext.empty())).isEmpty();
    }

    @Test
    @DisplayName("Generation runs at the higher temperature with plain-text output")
    void usesGenerationSettings() {
        when(chatCompletionClient.complete(any())).thenReturn("Ok");

        generator.generate(message(), analysis, BusinessContext.empty());

        ArgumentCaptor<ChatCompletionRequest> captor = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        verify(chatCompletionClient).complete(captor.capture());
        assertThat(captor.getValue().temperature()).isEqualTo(0.7);
        assertThat(captor.getValue().jsonOutput()).isFalse();
    }

    private InboundMessage message() {
        return new InboundMessage("+393331234567", null, "Che orari avete?", Channel.SMS, Provider.SKEBBY,
                "ord-1", Instant.parse("2024-05-15T08:00:00Z"), null);
    }
}
