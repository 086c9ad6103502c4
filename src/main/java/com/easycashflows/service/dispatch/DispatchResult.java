package com.easycashflows.service.dispatch;

import com.easycashflows.domain.enums.DispatchStatus;

public record DispatchResult(DispatchStatus status, String messageId, String error) {

    public static DispatchResult sent(String messageId) {
        return new DispatchResult(DispatchStatus.SENT, messageId, null);
    }

    public static DispatchResult failed(String error) {
        return new DispatchResult(DispatchStatus.FAILED, null, error);
    }

    public static DispatchResult unsupported(String error) {
        return new DispatchResult(DispatchStatus.UNSUPPORTED, null, error);
    }

    public boolean isSuccess() {
        return status == DispatchStatus.SENT;
    }
}
