package com.easycashflows.service.rules;

import com.easycashflows.service.dispatch.DispatchResult;

import java.util.List;

public record RuleDispatchResult(Status status, String messageId, String error, List<DispatchResult> deliveries) {

    public enum Status {
        SENT,
        CONDITIONS_NOT_MET,
        NOT_NOW,
        NOT_SUPPORTED,
        NO_RECIPIENTS,
        FAILED
    }

    public RuleDispatchResult {
        deliveries = deliveries == null ? List.of() : List.copyOf(deliveries);
    }

    public static RuleDispatchResult skipped(Status status, String error) {
        return new RuleDispatchResult(status, null, error, List.of());
    }

    public boolean success() {
        return status == Status.SENT;
    }
}
