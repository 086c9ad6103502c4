package com.easycashflows.service;

import com.easycashflows.domain.enums.AnalysisOutcome;
import com.easycashflows.domain.enums.ReplySource;
import com.easycashflows.domain.message.InboundMessage;
import com.easycashflows.domain.message.IntentAnalysis;
import com.easycashflows.domain.model.MessageAnalysis;
import com.easycashflows.repository.MessageAnalysisRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Records how each inbound message was handled and aggregates it into AI analytics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiAnalyticsService {

    private static final int TOP_INTENTS = 5;

    private final MessageAnalysisRepository messageAnalysisRepository;

    /**
     * Best effort: a failed write is logged and never interrupts message handling.
     */
    public void record(InboundMessage message, IntentAnalysis analysis, ReplySource replySource, boolean escalated) {
        MessageAnalysis entry = new MessageAnalysis();
        entry.setProvider(message.provider());
        entry.setChannel(message.channel());
        entry.setMessageId(message.messageId());
        entry.setIntent(analysis.intent());
        entry.setUrgency(analysis.urgency());
        entry.setConfidence(analysis.confidence());
        entry.setAnalysisOutcome(analysis.outcome());
        entry.setReplySource(replySource);
        entry.setEscalated(escalated);
        try {
            messageAnalysisRepository.save(entry);
        } catch (DataAccessException e) {
            log.warn("Failed to record message analysis. messageId={}, error={}", message.messageId(), e.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public AiAnalytics summary() {
        long total = messageAnalysisRepository.count();
        long aiResponses = messageAnalysisRepository.countByReplySource(ReplySource.AI);
        List<IntentShare> intents = messageAnalysisRepository
                .countByIntent(AnalysisOutcome.CLASSIFIED, PageRequest.of(0, TOP_INTENTS)).stream()
                .map(row -> new IntentShare(row.getIntent().name().toLowerCase(Locale.ROOT),
                        row.getTotal() == null ? 0 : row.getTotal()))
                .toList();
        Double average = messageAnalysisRepository.averageConfidence(AnalysisOutcome.CLASSIFIED);

        return new AiAnalytics(
                total,
                aiResponses,
                total > 0 ? Math.round(aiResponses * 100.0 / total) : 0,
                intents,
                average == null ? 0.0 : Math.round(average * 1000) / 10.0);
    }

    /**
     * @param responseRate      AI replies as a whole percentage of all handled messages
     * @param averageConfidence mean confidence of classified messages, as a percentage with one decimal
     */
    public record AiAnalytics(
            long totalMessages,
            long aiResponses,
            long responseRate,
            List<IntentShare> commonIntents,
            double averageConfidence
    ) {
    }

    public record IntentShare(String intent, long count) {
    }
}
