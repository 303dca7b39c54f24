package com.aigreentick.services.conversations.client;

import com.aigreentick.services.conversations.service.TenantCredentials;

import java.util.List;
import java.util.Map;

/**
 * Outbound WhatsApp messaging.
 *
 * Implementations throw {@link com.aigreentick.services.conversations.exception.MessagingClientException}
 * with {@code retryable} set for transient failures (5xx, 429, timeouts, open circuit).
 */
public interface WhatsAppMessagingClient {

    MessageSendResponse sendText(TenantCredentials channel, String to, String text);

    MessageSendResponse sendTemplate(TenantCredentials channel, String to, String templateName,
                                     String languageCode, List<Map<String, Object>> components);

    MessageSendResponse sendInteractive(TenantCredentials channel, String to, String body, List<String> buttons);
}
