package com.easycashflows.domain.enums;

public enum NotificationPriority {
    NORMAL,
    URGENT
}
