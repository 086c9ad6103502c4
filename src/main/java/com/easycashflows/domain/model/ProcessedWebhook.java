package com.easycashflows.domain.model;

import com.easycashflows.domain.enums.Provider;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "processed_webhooks",
        uniqueConstraints = @UniqueConstraint(name = "uq_processed_webhooks_delivery", columnNames = {"provider", "message_id"}),
        indexes = @Index(name = "idx_processed_webhooks_created", columnList = "created_at"))
public class ProcessedWebhook extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Provider provider;

    @Column(name = "message_id", nullable = false)
    private String messageId;
}
