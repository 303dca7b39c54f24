package com.aigreentick.services.conversations.repository;

import com.aigreentick.services.conversations.entity.MessageTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MessageTemplateRepository extends JpaRepository<MessageTemplate, Long> {

    Optional<MessageTemplate> findByOrganizationIdAndNameAndLanguage(Long organizationId, String name, String language);

    Optional<MessageTemplate> findByProviderTemplateId(String providerTemplateId);

    Optional<MessageTemplate> findFirstByOrganizationIdAndName(Long organizationId, String name);
}
