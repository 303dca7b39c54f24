package com.aigreentick.services.conversations.repository;

import com.aigreentick.services.conversations.entity.OutboundMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface OutboundMessageRepository extends JpaRepository<OutboundMessage, Long> {

    Optional<OutboundMessage> findByProviderMessageId(String providerMessageId);

    long countByOrganizationIdAndCreatedAtAfter(Long organizationId, LocalDateTime since);
}
