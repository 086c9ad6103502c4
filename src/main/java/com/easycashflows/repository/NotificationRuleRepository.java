package com.easycashflows.repository;

import com.easycashflows.domain.model.NotificationRule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface NotificationRuleRepository extends JpaRepository<NotificationRule, UUID> {
    List<NotificationRule> findByTriggerEventAndEnabledTrue(String triggerEvent);
}
