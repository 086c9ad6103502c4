package com.easycashflows.service;

import com.easycashflows.config.WebhookProperties;
import com.easycashflows.repository.ProcessedWebhookRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProcessedWebhookJanitor")
class ProcessedWebhookJanitorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-15T03:30:00Z"), ZoneOffset.UTC);

    @Mock
    private ProcessedWebhookRepository processedWebhookRepository;

    @Test
    @DisplayName("Purges keys older than the default retention")
    void defaultRetention() {
        new ProcessedWebhookJanitor(processedWebhookRepository, properties(null), CLOCK).purgeExpired();

        verify(processedWebhookRepository).deleteOlderThan(OffsetDateTime.parse("2024-05-08T03:30:00Z"));
    }

    @Test
    @DisplayName("Honors configured retention days")
    void configuredRetention() {
        new ProcessedWebhookJanitor(processedWebhookRepository, properties(2), CLOCK).purgeExpired();

        verify(processedWebhookRepository).deleteOlderThan(OffsetDateTime.parse("2024-05-13T03:30:00Z"));
    }

    private static WebhookProperties properties(Integer retentionDays) {
        return new WebhookProperties(null, null, null, null, null, null, retentionDays, null, null, null, null, null);
    }
}
