package com.easycashflows.service;

import com.easycashflows.domain.message.WebhookEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands normalized webhook events to the processing pool so controllers can acknowledge at once.
 */
@Slf4j
@Service
public class WebhookIngressService {

    private final InboundMessagePipeline inboundMessagePipeline;
    private final DeliveryStatusService deliveryStatusService;
    private final Executor webhookProcessingExecutor;

    @Autowired
    public WebhookIngressService(InboundMessagePipeline inboundMessagePipeline,
                                 DeliveryStatusService deliveryStatusService,
                                 @Qualifier("webhookProcessingExecutor") Executor webhookProcessingExecutor) {
        this.inboundMessagePipeline = inboundMessagePipeline;
        this.deliveryStatusService = deliveryStatusService;
        this.webhookProcessingExecutor = webhookProcessingExecutor;
    }

    public void submit(List<WebhookEvent> events) {
        for (WebhookEvent event : events) {
            try {
                webhookProcessingExecutor.execute(() -> process(event));
            } catch (RejectedExecutionException e) {
                log.error("Processing queue is full, dropping webhook event {}", describe(event), e);
            }
        }
    }

    void process(WebhookEvent event) {
        try {
            if (event instanceof WebhookEvent.MessageReceived received) {
                inboundMessagePipeline.handle(received.message());
            } else if (event instanceof WebhookEvent.StatusReported reported) {
                deliveryStatusService.apply(reported.update());
            }
        } catch (Exception e) {
            log.error("Failed to process webhook event {}: {}", describe(event), e.getMessage(), e);
        }
    }

    private String describe(WebhookEvent event) {
        if (event instanceof WebhookEvent.MessageReceived received) {
            return "message " + received.message().deduplicationKey();
        }
        WebhookEvent.StatusReported reported = (WebhookEvent.StatusReported) event;
        return "status " + reported.update().provider().id() + ":" + reported.update().messageId();
    }
}
