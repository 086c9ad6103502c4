package com.easycashflows.domain.model;

/**
 * One clause of a notification rule, compared against {@code triggerData[field]}.
 * The operator is kept as written by the operator so that unknown values can fail closed.
 */
public record NotificationCondition(String field, String operator, Object value) {
}
