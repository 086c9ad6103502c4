package com.easycashflows.repository;

import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.model.OutboundMessageLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface OutboundMessageLogRepository extends JpaRepository<OutboundMessageLog, UUID> {
    List<OutboundMessageLog> findByProviderAndProviderMessageId(Provider provider, String providerMessageId);
}
