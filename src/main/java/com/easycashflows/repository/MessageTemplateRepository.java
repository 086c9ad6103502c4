package com.easycashflows.repository;

import com.easycashflows.domain.model.MessageTemplate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface MessageTemplateRepository extends JpaRepository<MessageTemplate, UUID> {
}
