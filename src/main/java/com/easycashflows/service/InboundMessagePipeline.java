package com.easycashflows.service;

import com.easycashflows.config.AiProperties;
import com.easycashflows.domain.enums.NotificationPriority;
import com.easycashflows.domain.enums.ReplySource;
import com.easycashflows.domain.message.BusinessContext;
import com.easycashflows.domain.message.InboundMessage;
import com.easycashflows.domain.message.IntentAnalysis;
import com.easycashflows.domain.message.OutboundResponse;
import com.easycashflows.service.CommonScenarioMatcher.ScenarioMatch;
import com.easycashflows.service.ai.BusinessContextSource;
import com.easycashflows.service.ai.IntentClassifier;
import com.easycashflows.service.ai.ResponseGenerator;
import com.easycashflows.service.dispatch.DispatchService;
import com.easycashflows.util.WebhookText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Handles one normalized inbound message: duplicate check, classification, reply selection
 * (AI, then keyword scenario, then business-hours notice), outbound reply, team fanout and the
 * analytics record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboundMessagePipeline {

    private final DeliveryDeduplicator deliveryDeduplicator;
    private final BusinessContextSource businessContextSource;
    private final IntentClassifier intentClassifier;
    private final ResponseGenerator responseGenerator;
    private final CommonScenarioMatcher commonScenarioMatcher;
    private final BusinessHoursPolicy businessHoursPolicy;
    private final DispatchService dispatchService;
    private final TeamNotificationService teamNotificationService;
    private final AiProperties aiProperties;
    private final AiAnalyticsService aiAnalyticsService;

    public HandlingOutcome handle(InboundMessage message) {
        if (!deliveryDeduplicator.markProcessed(message)) {
            return HandlingOutcome.duplicateDelivery();
        }
        log.info("Handling inbound message. provider={}, channel={}, messageId={}, from={}, preview={}",
                message.provider().id(), message.channel().id(), message.messageId(),
                WebhookText.mask(message.from()), message.preview(50));

        BusinessContext context = loadContext(message);
        IntentAnalysis analysis = intentClassifier.classify(message, context);
        Optional<ScenarioMatch> scenario = commonScenarioMatcher.match(message);

        ReplySource source = ReplySource.NONE;
        String reply = null;
        if (analysis.shouldRespond() && analysis.isConfidentAbove(aiProperties.resolveConfidenceThreshold())) {
            reply = responseGenerator.generate(message, analysis, context).orElse(null);
            if (reply != null) {
                source = ReplySource.AI;
            }
        }
        if (reply == null && scenario.isPresent()) {
            reply = scenario.get().reply();
            source = ReplySource.COMMON_SCENARIO;
        }
        if (reply == null) {
            reply = businessHoursPolicy.statusMessage();
            source = ReplySource.BUSINESS_HOURS;
        }

        dispatchService.sendAsync(OutboundResponse.replyTo(message, reply));

        boolean escalate = analysis.flagsUrgency() || scenario.map(ScenarioMatch::escalate).orElse(false);
        if (escalate) {
            teamNotificationService.notifyTeam(message, NotificationPriority.URGENT, analysis, source);
        } else if (source != ReplySource.AI) {
            teamNotificationService.notifyTeam(message, NotificationPriority.NORMAL, analysis, source);
        }

        aiAnalyticsService.record(message, analysis, source, escalate);

        log.info("Inbound message handled. messageId={}, replySource={}, escalated={}, intent={}, confidence={}",
                message.messageId(), source, escalate, analysis.intent(), analysis.confidence());
        return new HandlingOutcome(source, reply, escalate, false);
    }

    private BusinessContext loadContext(InboundMessage message) {
        try {
            BusinessContext context = businessContextSource.snapshotFor(message.from());
            return context == null ? BusinessContext.empty() : context;
        } catch (RuntimeException e) {
            log.warn("Business context unavailable. messageId={}, error={}", message.messageId(), e.getMessage());
            return BusinessContext.empty();
        }
    }
}
