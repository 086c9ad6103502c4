package com.easycashflows.service;

import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.message.DeliveryStatusUpdate;
import com.easycashflows.domain.model.OutboundMessageLog;
import com.easycashflows.repository.OutboundMessageLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeliveryStatusService")
class DeliveryStatusServiceTest {

    @Mock
    private OutboundMessageLogRepository outboundMessageLogRepository;

    private DeliveryStatusService deliveryStatusService;

    @BeforeEach
    void setUp() {
        deliveryStatusService = new DeliveryStatusService(outboundMessageLogRepository,
                Clock.fixed(Instant.parse("2024-05-15T08:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Updates the outbound log row matching the provider message id")
    void updatesKnownMessage() {
        OutboundMessageLog entry = new OutboundMessageLog();
        entry.setProvider(Provider.TWILIO);
        entry.setProviderMessageId("SM1");
        when(outboundMessageLogRepository.findByProviderAndProviderMessageId(Provider.TWILIO, "SM1"))
                .thenReturn(List.of(entry));

        int updated = deliveryStatusService.apply(new DeliveryStatusUpdate(Provider.TWILIO, "SM1", "delivered",
                Instant.parse("2024-05-15T07:59:00Z")));

        assertThat(updated).isEqualTo(1);
        assertThat(entry.getDeliveryStatus()).isEqualTo("delivered");
        assertThat(entry.getStatusUpdatedAt().toInstant()).isEqualTo(Instant.parse("2024-05-15T07:59:00Z"));
        verify(outboundMessageLogRepository).saveAll(List.of(entry));
    }

    @Test
    @DisplayName("Status for an unknown message id is ignored")
    void ignoresUnknownMessage() {
        when(outboundMessageLogRepository.findByProviderAndProviderMessageId(Provider.FACEBOOK, "mid.x"))
                .thenReturn(List.of());

        int updated = deliveryStatusService.apply(new DeliveryStatusUpdate(Provider.FACEBOOK, "mid.x", "delivered", null));

        assertThat(updated).isZero();
        verify(outboundMessageLogRepository, never()).saveAll(any());
    }
}
