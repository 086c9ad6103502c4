package com.easycashflows.service.rules;

import com.easycashflows.domain.enums.ConditionOperator;
import com.easycashflows.domain.enums.DispatchStatus;
import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.enums.TimingDecision;
import com.easycashflows.domain.model.MessageTemplate;
import com.easycashflows.domain.model.NotificationCondition;
import com.easycashflows.domain.model.NotificationRule;
import com.easycashflows.domain.model.NotificationTiming;
import com.easycashflows.service.dispatch.DispatchResult;
import com.easycashflows.service.dispatch.DispatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates operator-defined notification rules against business events and fans the
 * rendered template out to the resolved recipients.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationRuleEngine {

    static final String USER_PHONE_FIELD = "userPhoneNumber";
    static final String COMPANY_CONTACTS_FIELD = "companyContacts";

    private final DispatchService dispatchService;
    private final TemplateRenderer templateRenderer;
    private final Clock clock;

    /**
     * All conditions must hold. A missing or empty condition list always matches.
     */
    public boolean evaluate(NotificationRule rule, Map<String, Object> triggerData) {
        List<NotificationCondition> conditions = rule.getConditions();
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        return conditions.stream().allMatch(condition -> matches(condition, triggerData));
    }

    public TimingDecision timingDecision(NotificationTiming timing) {
        if (timing == null) {
            return TimingDecision.SEND_NOW;
        }
        if (timing.type() == null) {
            return TimingDecision.NOT_NOW;
        }
        return switch (timing.type()) {
            case IMMEDIATE -> TimingDecision.SEND_NOW;
            case SCHEDULE -> scheduleMatches(timing, ZonedDateTime.now(clock))
                    ? TimingDecision.SEND_NOW
                    : TimingDecision.NOT_NOW;
            case DELAY -> TimingDecision.NOT_SUPPORTED;
        };
    }

    public List<String> resolveRecipients(NotificationRule rule, Map<String, Object> triggerData) {
        if (rule.getRecipientType() == null) {
            return List.of();
        }
        return switch (rule.getRecipientType()) {
            case USER -> {
                Object phone = triggerData.get(USER_PHONE_FIELD);
                yield phone == null || phone.toString().isBlank() ? List.of() : List.of(phone.toString());
            }
            case COMPANY_CONTACTS -> addresses(triggerData.get(COMPANY_CONTACTS_FIELD));
            case CUSTOM -> addresses(rule.getCustomRecipients());
        };
    }

    public RuleDispatchResult dispatch(NotificationRule rule, MessageTemplate template,
                                       Map<String, Object> triggerData, Provider provider) {
        if (!evaluate(rule, triggerData)) {
            return RuleDispatchResult.skipped(RuleDispatchResult.Status.CONDITIONS_NOT_MET, "Conditions not met");
        }

        TimingDecision timing = timingDecision(rule.getTiming());
        if (timing == TimingDecision.NOT_NOW) {
            return RuleDispatchResult.skipped(RuleDispatchResult.Status.NOT_NOW, "Not the right time to send");
        }
        if (timing == TimingDecision.NOT_SUPPORTED) {
            log.warn("Rule {} uses delayed timing, which has no scheduler yet", rule.getId());
            return RuleDispatchResult.skipped(RuleDispatchResult.Status.NOT_SUPPORTED,
                    "Delayed notifications are not yet supported");
        }

        List<String> recipients = resolveRecipients(rule, triggerData);
        if (recipients.isEmpty()) {
            return RuleDispatchResult.skipped(RuleDispatchResult.Status.NO_RECIPIENTS, "No recipients resolved");
        }

        String text = templateRenderer.render(template.getBody(), triggerData);
        List<DispatchResult> results = dispatchService.sendAll(provider, rule.getChannel(), recipients, text, rule.getId());

        Optional<DispatchResult> firstSent = results.stream().filter(DispatchResult::isSuccess).findFirst();
        long sent = results.stream().filter(DispatchResult::isSuccess).count();
        log.info("Rule dispatched. ruleId={}, provider={}, recipients={}, sent={}",
                rule.getId(), provider.id(), recipients.size(), sent);
        if (firstSent.isPresent()) {
            return new RuleDispatchResult(RuleDispatchResult.Status.SENT, firstSent.get().messageId(), null, results);
        }
        if (results.stream().allMatch(r -> r.status() == DispatchStatus.UNSUPPORTED)) {
            return new RuleDispatchResult(RuleDispatchResult.Status.NOT_SUPPORTED, null, results.get(0).error(), results);
        }
        return new RuleDispatchResult(RuleDispatchResult.Status.FAILED, null, "All sends failed", results);
    }

    private boolean matches(NotificationCondition condition, Map<String, Object> triggerData) {
        Optional<ConditionOperator> operator = ConditionOperator.parse(condition.operator());
        if (operator.isEmpty() || condition.field() == null) {
            return false;
        }
        Object actual = triggerData.get(condition.field());
        Object expected = condition.value();
        if (actual == null || expected == null) {
            return false;
        }

        BigDecimal actualNumber = asNumber(actual);
        BigDecimal expectedNumber = asNumber(expected);
        int cmp;
        if (actualNumber != null && expectedNumber != null) {
            cmp = actualNumber.compareTo(expectedNumber);
        } else if (actual instanceof String actualText && expected instanceof String expectedText) {
            cmp = actualText.compareTo(expectedText);
        } else {
            return operator.get() == ConditionOperator.EQ && actual.equals(expected);
        }

        return switch (operator.get()) {
            case GT -> cmp > 0;
            case LT -> cmp < 0;
            case EQ -> cmp == 0;
            case GTE -> cmp >= 0;
            case LTE -> cmp <= 0;
        };
    }

    private BigDecimal asNumber(Object value) {
        if (!(value instanceof Number number)) {
            return null;
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean scheduleMatches(NotificationTiming timing, ZonedDateTime now) {
        if (timing.scheduleDays() != null && !timing.scheduleDays().isEmpty()
                && !timing.scheduleDays().contains(now.getDayOfWeek())) {
            return false;
        }
        if (timing.scheduleTime() == null || timing.scheduleTime().isBlank()) {
            return true;
        }
        String[] parts = timing.scheduleTime().trim().split(":");
        if (parts.length != 2) {
            log.warn("Ignoring malformed schedule time '{}'", timing.scheduleTime());
            return false;
        }
        try {
            int hour = Integer.parseInt(parts[0]);
            int minute = Integer.parseInt(parts[1]);
            return now.getHour() == hour && now.getMinute() == minute;
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed schedule time '{}'", timing.scheduleTime());
            return false;
        }
    }

    private List<String> addresses(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof Collection<?> values) {
            List<String> out = new ArrayList<>();
            for (Object value : values) {
                if (value != null && !value.toString().isBlank()) {
                    out.add(value.toString().trim());
                }
            }
            return out;
        }
        String single = raw.toString();
        return single.isBlank() ? List.of() : List.of(single.trim());
    }
}
