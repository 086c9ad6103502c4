package com.easycashflows.domain.enums;

public enum DispatchStatus {
    SENT,
    FAILED,
    UNSUPPORTED
}
