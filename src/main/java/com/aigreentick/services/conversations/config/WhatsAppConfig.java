package com.aigreentick.services.conversations.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Typed config properties for the WhatsApp Cloud API and its webhooks.
 *
 * Bound from application.yml under prefix "whatsapp":
 * ┌─────────────────────────────────────────────────────────────────┐
 * │  whatsapp:                                                      │
 * │    app-secret:              ${WHATSAPP_APP_SECRET:}            │
 * │    webhook-verify-token:    ${WEBHOOK_VERIFY_TOKEN}            │
 * │    graph-api-version:       v21.0                              │
 * │    graph-api-base-url:      https://graph.facebook.com         │
 * │    allow-unsigned-webhooks: false                              │
 * └─────────────────────────────────────────────────────────────────┘
 *
 * The app secret is only the fallback signing secret: tenants with their
 * own Meta app carry an encrypted secret in tenant_channels.
 */
@Configuration
@ConfigurationProperties(prefix = "whatsapp")
@Data
public class WhatsAppConfig {

    /** Global app secret used to verify X-Hub-Signature-256 when no tenant secret resolves */
    private String appSecret;

    /** Token Meta echoes back during the GET challenge */
    private String webhookVerifyToken;

    private String graphApiVersion = "v21.0";

    /** Base URL for Graph API (override in tests) */
    private String graphApiBaseUrl = "https://graph.facebook.com";

    /**
     * Accept webhook deliveries without a signature check when no secret is configured.
     * Off by default; turning it on is logged at startup and on every unsigned delivery.
     */
    private boolean allowUnsignedWebhooks = false;

    /** Timeouts for outbound provider calls */
    private int connectTimeoutMs = 10_000;
    private int readTimeoutSeconds = 30;

    public String getVersionedBaseUrl() {
        return graphApiBaseUrl + "/" + graphApiVersion;
    }

    public boolean hasGlobalAppSecret() {
        return appSecret != null && !appSecret.isBlank();
    }
}
