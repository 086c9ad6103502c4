package com.easycashflows.service;

import com.easycashflows.domain.enums.ReplySource;

public record HandlingOutcome(ReplySource replySource, String replyText, boolean escalated, boolean duplicate) {

    public static HandlingOutcome duplicateDelivery() {
        return new HandlingOutcome(ReplySource.NONE, null, false, true);
    }
}
