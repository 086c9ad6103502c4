package com.easycashflows.domain.message;

/**
 * Result of normalizing a provider payload: either a message to handle or a delivery-status report.
 */
public sealed interface WebhookEvent permits WebhookEvent.MessageReceived, WebhookEvent.StatusReported {

    record MessageReceived(InboundMessage message) implements WebhookEvent {
    }

    record StatusReported(DeliveryStatusUpdate update) implements WebhookEvent {
    }
}
