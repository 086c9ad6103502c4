package com.easycashflows.domain.enums;

public enum RecipientType {
    USER,
    COMPANY_CONTACTS,
    CUSTOM
}
