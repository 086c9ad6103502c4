package com.easycashflows.service;

import com.easycashflows.domain.enums.NotificationPriority;
import com.easycashflows.domain.enums.ReplySource;
import com.easycashflows.domain.enums.TeamNotificationType;
import com.easycashflows.domain.message.InboundMessage;
import com.easycashflows.domain.message.IntentAnalysis;
import com.easycashflows.domain.model.TeamNotification;
import com.easycashflows.repository.TeamNotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Internal fanout: in-app notifications for the operations team about inbound messages.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TeamNotificationService {

    private static final int PREVIEW_LENGTH = 200;

    private final TeamNotificationRepository teamNotificationRepository;

    public TeamNotification notifyTeam(InboundMessage message, NotificationPriority priority,
                                       IntentAnalysis analysis, ReplySource replySource) {
        boolean urgent = priority == NotificationPriority.URGENT;

        TeamNotification notification = new TeamNotification();
        notification.setTitle(urgent
                ? "Messaggio urgente via " + message.channel().id()
                : "Nuovo messaggio via " + message.channel().id());
        notification.setMessage("Da: " + message.from() + "\n" + message.preview(PREVIEW_LENGTH));
        notification.setType(urgent ? TeamNotificationType.WARNING : TeamNotificationType.INFO);
        notification.setPriority(priority);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("provider", message.provider().id());
        metadata.put("channel", message.channel().id());
        metadata.put("messageId", message.messageId());
        metadata.put("from", message.from());
        metadata.put("receivedAt", message.receivedAt().toString());
        metadata.put("intent", analysis.intent().name().toLowerCase(Locale.ROOT));
        metadata.put("urgency", analysis.urgency().name().toLowerCase(Locale.ROOT));
        metadata.put("confidence", analysis.confidence());
        metadata.put("analysisOutcome", analysis.outcome().name());
        metadata.put("replySource", replySource.name());
        if (message.subject() != null) {
            metadata.put("subject", message.subject());
        }
        notification.setMetadata(metadata);

        TeamNotification saved = teamNotificationRepository.save(notification);
        log.info("Team notified. priority={}, messageId={}, replySource={}", priority, message.messageId(), replySource);
        return saved;
    }
}
