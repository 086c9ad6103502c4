package com.easycashflows.domain.model;

import com.easycashflows.domain.enums.AnalysisOutcome;
import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.IntentType;
import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.enums.ReplySource;
import com.easycashflows.domain.enums.Urgency;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Outcome of handling one inbound message, kept for AI analytics.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "message_analyses", indexes = {
        @Index(name = "idx_message_analyses_created", columnList = "created_at")
})
public class MessageAnalysis extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Provider provider;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Channel channel;

    @Column(name = "message_id", nullable = false)
    private String messageId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private IntentType intent;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Urgency urgency;

    @Column(nullable = false)
    private double confidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "analysis_outcome", nullable = false, length = 16)
    private AnalysisOutcome analysisOutcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "reply_source", nullable = false, length = 32)
    private ReplySource replySource;

    @Column(nullable = false)
    private boolean escalated;
}
