package com.aigreentick.services.conversations.exception;

/**
 * Thrown when a provider send fails permanently or exhausts its retries
 */
public class DispatchFailedException extends ConversationServiceException {

    public DispatchFailedException(String message) {
        super(message, "DISPATCH_FAILED");
    }

    public DispatchFailedException(String message, Throwable cause) {
        super(message, "DISPATCH_FAILED", cause);
    }
}
