package com.easycashflows.repository;

import com.easycashflows.domain.model.TeamNotification;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface TeamNotificationRepository extends JpaRepository<TeamNotification, UUID> {
}
