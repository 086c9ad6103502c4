package com.easycashflows.domain.model;

import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.enums.RecipientType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "notification_rules", indexes = {
        @Index(name = "idx_notification_rules_event", columnList = "trigger_event,enabled")
})
public class NotificationRule extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "trigger_event", nullable = false, length = 100)
    private String triggerEvent;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "template_id", nullable = false)
    private UUID templateId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Provider provider = Provider.TWILIO;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Channel channel = Channel.WHATSAPP;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private List<NotificationCondition> conditions;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private NotificationTiming timing;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_type", nullable = false, length = 50)
    private RecipientType recipientType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "custom_recipients", columnDefinition = "jsonb")
    private List<String> customRecipients = new ArrayList<>();
}
