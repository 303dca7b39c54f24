package com.aigreentick.services.conversations.exception;

/**
 * Thrown when the GET challenge handshake fails
 */
public class WebhookVerificationException extends ConversationServiceException {

    private final boolean badRequest;

    public WebhookVerificationException(String message, boolean badRequest) {
        super(message, "WEBHOOK_VERIFICATION_FAILED");
        this.badRequest = badRequest;
    }

    public static WebhookVerificationException invalidMode(String mode) {
        return new WebhookVerificationException("Invalid hub.mode: " + mode, true);
    }

    public static WebhookVerificationException tokenMismatch() {
        return new WebhookVerificationException("Invalid verify token", false);
    }

    public boolean isBadRequest() {
        return badRequest;
    }
}
