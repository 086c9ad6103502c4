package com.easycashflows.service;

import com.easycashflows.domain.message.InboundMessage;
import com.easycashflows.domain.model.ProcessedWebhook;
import com.easycashflows.repository.ProcessedWebhookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Duplicate-check hook keyed by (provider, messageId). The unique constraint on
 * {@code processed_webhooks} settles races between two concurrent redeliveries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryDeduplicator {

    private final ProcessedWebhookRepository processedWebhookRepository;

    /**
     * @return {@code true} the first time a delivery is seen, {@code false} for a redelivery
     */
    public boolean markProcessed(InboundMessage message) {
        if (processedWebhookRepository.existsByProviderAndMessageId(message.provider(), message.messageId())) {
            log.info("Skip duplicate delivery. key={}", message.deduplicationKey());
            return false;
        }
        ProcessedWebhook processed = new ProcessedWebhook();
        processed.setProvider(message.provider());
        processed.setMessageId(message.messageId());
        try {
            processedWebhookRepository.saveAndFlush(processed);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Skip duplicate delivery (concurrent). key={}", message.deduplicationKey());
            return false;
        }
    }
}
