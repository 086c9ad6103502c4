package com.easycashflows.domain.enums;

public enum TimingDecision {
    SEND_NOW,
    NOT_NOW,
    NOT_SUPPORTED
}
