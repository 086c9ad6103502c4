package com.easycashflows.service.rules;

import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.model.MessageTemplate;
import com.easycashflows.domain.model.NotificationRule;
import com.easycashflows.repository.MessageTemplateRepository;
import com.easycashflows.repository.NotificationRuleRepository;
import com.easycashflows.service.dispatch.UnknownProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BusinessEventService {

    public record RuleEvaluation(UUID ruleId, String ruleName, RuleDispatchResult result) {
    }

    private final NotificationRuleRepository notificationRuleRepository;
    private final MessageTemplateRepository messageTemplateRepository;
    private final NotificationRuleEngine notificationRuleEngine;

    /**
     * Runs every enabled rule bound to {@code event}. A non-null {@code providerId} overrides
     * the provider configured on each rule.
     *
     * @throws UnknownProviderException if {@code providerId} names no known provider
     */
    public List<RuleEvaluation> publish(String event, Map<String, Object> triggerData, String providerId) {
        Optional<Provider> override = Optional.empty();
        if (providerId != null && !providerId.isBlank()) {
            override = Optional.of(Provider.fromId(providerId)
                    .orElseThrow(() -> new UnknownProviderException(providerId)));
        }
        Map<String, Object> data = triggerData == null ? Map.of() : triggerData;

        List<NotificationRule> rules = notificationRuleRepository.findByTriggerEventAndEnabledTrue(event);
        log.info("Business event received. event={}, rules={}", event, rules.size());

        List<RuleEvaluation> evaluations = new ArrayList<>();
        for (NotificationRule rule : rules) {
            RuleDispatchResult result;
            try {
                result = run(rule, data, override.orElse(rule.getProvider()));
            } catch (Exception e) {
                log.error("Failed to process rule {} for event {}: {}", rule.getId(), event, e.getMessage(), e);
                result = RuleDispatchResult.skipped(RuleDispatchResult.Status.FAILED, "Processing failed");
            }
            evaluations.add(new RuleEvaluation(rule.getId(), rule.getName(), result));
        }
        return evaluations;
    }

    private RuleDispatchResult run(NotificationRule rule, Map<String, Object> data, Provider provider) {
        MessageTemplate template = rule.getTemplateId() == null
                ? null
                : messageTemplateRepository.findById(rule.getTemplateId()).orElse(null);
        if (template == null) {
            log.warn("Rule {} references missing template {}", rule.getId(), rule.getTemplateId());
            return RuleDispatchResult.skipped(RuleDispatchResult.Status.FAILED, "Template not found");
        }
        return notificationRuleEngine.dispatch(rule, template, data, provider);
    }
}
