package com.easycashflows.repository;

import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.model.ProcessedWebhook;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.UUID;

public interface ProcessedWebhookRepository extends JpaRepository<ProcessedWebhook, UUID> {

    boolean existsByProviderAndMessageId(Provider provider, String messageId);

    @Modifying
    @Query("delete from ProcessedWebhook p where p.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") OffsetDateTime cutoff);
}
