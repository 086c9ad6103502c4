package com.easycashflows.domain.enums;

public enum ReplySource {
    AI,
    COMMON_SCENARIO,
    BUSINESS_HOURS,
    NONE
}
