package com.easycashflows.domain.model;

import com.easycashflows.domain.enums.NotificationPriority;
import com.easycashflows.domain.enums.TeamNotificationType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * In-app notification addressed to every operator of the back office.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "team_notifications", indexes = {
        @Index(name = "idx_team_notifications_unread", columnList = "is_read,created_at")
})
public class TeamNotification extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, columnDefinition = "text")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TeamNotificationType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private NotificationPriority priority;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "is_read", nullable = false)
    private boolean read = false;
}
