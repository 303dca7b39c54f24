package com.aigreentick.services.conversations.exception;

/**
 * Thrown when a webhook envelope carries an object type this service does not handle
 */
public class UnsupportedWebhookObjectException extends ConversationServiceException {

    public UnsupportedWebhookObjectException(String objectType) {
        super("Unsupported webhook object: " + objectType, "UNSUPPORTED_WEBHOOK_OBJECT");
    }
}
