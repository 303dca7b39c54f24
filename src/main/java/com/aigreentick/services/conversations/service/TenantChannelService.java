package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.entity.TenantChannel;
import com.aigreentick.services.conversations.exception.InvalidRequestException;
import com.aigreentick.services.conversations.repository.TenantChannelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TenantChannelService implements TenantCredentialResolver {

    private final TenantChannelRepository channelRepository;
    private final SecretEncryptionService encryptionService;

    @Override
    @Transactional(readOnly = true)
    public Optional<TenantCredentials> resolveByPhoneNumberId(String phoneNumberId) {
        if (phoneNumberId == null || phoneNumberId.isBlank()) {
            return Optional.empty();
        }
        return channelRepository.findByPhoneNumberIdAndActiveTrue(phoneNumberId).flatMap(this::toCredentials);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TenantCredentials> resolveForOrganization(Long organizationId) {
        return channelRepository.findFirstByOrganizationIdAndActiveTrue(organizationId).flatMap(this::toCredentials);
    }

    private Optional<TenantCredentials> toCredentials(TenantChannel channel) {
        try {
            String appSecret = channel.getEncryptedAppSecret() != null
                    ? encryptionService.decrypt(channel.getEncryptedAppSecret())
                    : null;
            return Optional.of(TenantCredentials.builder()
                    .organizationId(channel.getOrganizationId())
                    .phoneNumberId(channel.getPhoneNumberId())
                    .accessToken(encryptionService.decrypt(channel.getEncryptedAccessToken()))
                    .appSecret(appSecret)
                    .build());
        } catch (InvalidRequestException ex) {
            log.error("Channel credentials unreadable: organizationId={}, phoneNumberId={}: {}",
                    channel.getOrganizationId(), channel.getPhoneNumberId(), ex.getMessage());
            return Optional.empty();
        }
    }
}
