package com.easycashflows.service;

import com.easycashflows.domain.message.DeliveryStatusUpdate;
import com.easycashflows.domain.model.OutboundMessageLog;
import com.easycashflows.repository.OutboundMessageLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryStatusService {

    private final OutboundMessageLogRepository outboundMessageLogRepository;
    private final Clock clock;

    /**
     * @return number of outbound log rows updated; zero when the provider id is unknown to us
     */
    @Transactional
    public int apply(DeliveryStatusUpdate update) {
        List<OutboundMessageLog> entries =
                outboundMessageLogRepository.findByProviderAndProviderMessageId(update.provider(), update.messageId());
        if (entries.isEmpty()) {
            log.info("Ignore status for unknown message. provider={}, messageId={}, status={}",
                    update.provider().id(), update.messageId(), update.status());
            return 0;
        }
        OffsetDateTime reportedAt = update.reportedAt() == null
                ? OffsetDateTime.now(clock)
                : OffsetDateTime.ofInstant(update.reportedAt(), clock.getZone());
        for (OutboundMessageLog entry : entries) {
            entry.setDeliveryStatus(update.status());
            entry.setStatusUpdatedAt(reportedAt);
        }
        outboundMessageLogRepository.saveAll(entries);
        log.info("Delivery status updated. provider={}, messageId={}, status={}",
                update.provider().id(), update.messageId(), update.status());
        return entries.size();
    }
}
