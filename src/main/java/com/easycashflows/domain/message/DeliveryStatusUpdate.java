package com.easycashflows.domain.message;

import com.easycashflows.domain.enums.Provider;

import java.time.Instant;

public record DeliveryStatusUpdate(
        Provider provider,
        String messageId,
        String status,
        Instant reportedAt
) {
}
