package com.aigreentick.services.conversations.repository;

import com.aigreentick.services.conversations.entity.TenantChannel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TenantChannelRepository extends JpaRepository<TenantChannel, Long> {

    Optional<TenantChannel> findByPhoneNumberIdAndActiveTrue(String phoneNumberId);

    Optional<TenantChannel> findFirstByOrganizationIdAndActiveTrue(Long organizationId);
}
