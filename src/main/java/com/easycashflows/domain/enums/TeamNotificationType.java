package com.easycashflows.domain.enums;

public enum TeamNotificationType {
    INFO,
    WARNING
}
