package com.aigreentick.services.conversations.service;

import java.util.Optional;

/**
 * Resolves a tenant's channel credentials, either from the business phone
 * number a webhook was delivered for or from the organization sending a message.
 */
public interface TenantCredentialResolver {

    Optional<TenantCredentials> resolveByPhoneNumberId(String phoneNumberId);

    Optional<TenantCredentials> resolveForOrganization(Long organizationId);
}
