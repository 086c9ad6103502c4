package com.easycashflows.domain.model;

import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.DispatchStatus;
import com.easycashflows.domain.enums.Provider;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "outbound_message_log", indexes = {
        @Index(name = "idx_outbound_log_provider_message", columnList = "provider,provider_message_id")
})
public class OutboundMessageLog extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Provider provider;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Channel channel;

    @Column(nullable = false)
    private String recipient;

    @Column(name = "rule_id")
    private UUID ruleId;

    @Column(name = "source_message_id")
    private String sourceMessageId;

    @Column(name = "provider_message_id")
    private String providerMessageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "dispatch_status", nullable = false, length = 32)
    private DispatchStatus dispatchStatus;

    @Column(name = "delivery_status", length = 50)
    private String deliveryStatus;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "status_updated_at")
    private OffsetDateTime statusUpdatedAt;
}
