package com.aigreentick.services.conversations.service;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Decrypted credentials of one tenant's WhatsApp channel.
 */
@Getter
@Builder
@ToString(exclude = {"accessToken", "appSecret"})
public class TenantCredentials {

    private final Long organizationId;
    private final String phoneNumberId;
    private final String accessToken;

    /** Null when the tenant signs with the platform app */
    private final String appSecret;

    public boolean hasAppSecret() {
        return appSecret != null && !appSecret.isBlank();
    }
}
