package com.easycashflows.service;

import com.easycashflows.config.WebhookProperties;
import com.easycashflows.repository.ProcessedWebhookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProcessedWebhookJanitor {

    private static final int DEFAULT_RETENTION_DAYS = 7;

    private final ProcessedWebhookRepository processedWebhookRepository;
    private final WebhookProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${app.webhooks.dedup-purge-cron:0 30 3 * * *}")
    @Transactional
    public void purgeExpired() {
        int retentionDays = properties.dedupRetentionDays() == null
                ? DEFAULT_RETENTION_DAYS
                : Math.max(1, properties.dedupRetentionDays());
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minusDays(retentionDays);
        int deleted = processedWebhookRepository.deleteOlderThan(cutoff);
        if (deleted > 0) {
            log.info("Purged processed webhook keys. deleted={}, olderThan={}", deleted, cutoff);
        }
    }
}
