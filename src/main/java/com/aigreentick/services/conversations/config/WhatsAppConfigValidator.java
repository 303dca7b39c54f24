package com.aigreentick.services.conversations.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * Fail-fast validation for required WhatsApp and engine configuration.
 *
 * Required env vars:
 *   - WEBHOOK_VERIFY_TOKEN  → whatsapp.webhook-verify-token
 *   - SECRET_ENCRYPTION_KEY → secret.encryption.key
 *
 * WHATSAPP_APP_SECRET is optional only because tenants may carry their own
 * secret; running with neither a global secret nor signature enforcement is
 * reported loudly.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class WhatsAppConfigValidator {

    private final WhatsAppConfig whatsAppConfig;
    private final ConversationProperties conversationProperties;

    @Value("${secret.encryption.key:}")
    private String secretEncryptionKey;

    // Placeholder values that indicate config was not properly set
    private static final Set<String> PLACEHOLDER_VALUES = Set.of(
            "",
            "your-verify-token",
            "your-app-secret",
            "null",
            "undefined",
            "${WEBHOOK_VERIFY_TOKEN}",
            "${WHATSAPP_APP_SECRET}"
    );

    @PostConstruct
    public void validate() {
        log.info("Validating WhatsApp configuration...");

        validateRequired("WEBHOOK_VERIFY_TOKEN", "whatsapp.webhook-verify-token",
                whatsAppConfig.getWebhookVerifyToken());
        validateRequired("SECRET_ENCRYPTION_KEY", "secret.encryption.key", secretEncryptionKey);

        if (isNullOrPlaceholder(whatsAppConfig.getAppSecret())) {
            if (whatsAppConfig.isAllowUnsignedWebhooks()) {
                log.warn("WHATSAPP_APP_SECRET is not set and whatsapp.allow-unsigned-webhooks=true. " +
                        "Webhooks from tenants without their own secret will be processed UNVERIFIED.");
            } else {
                log.warn("WHATSAPP_APP_SECRET is not set. Webhooks are accepted only for tenants " +
                        "with a per-tenant app secret.");
            }
        }

        if (conversationProperties.getMaxHopsPerMessage() < 1) {
            throw new IllegalStateException("conversation.max-hops-per-message must be >= 1");
        }
        if (conversationProperties.getDispatch().getMaxAttempts() < 1) {
            throw new IllegalStateException("conversation.dispatch.max-attempts must be >= 1");
        }

        log.info("WhatsApp configuration validated. Graph API {}", whatsAppConfig.getGraphApiVersion());
    }

    private void validateRequired(String envVar, String configKey, String value) {
        if (isNullOrPlaceholder(value)) {
            throw new IllegalStateException(String.format(
                    "STARTUP FAILED: missing required configuration %s. Set env var %s before starting the service.",
                    configKey, envVar));
        }
    }

    private boolean isNullOrPlaceholder(String value) {
        if (value == null) return true;
        return PLACEHOLDER_VALUES.contains(value.trim());
    }
}
