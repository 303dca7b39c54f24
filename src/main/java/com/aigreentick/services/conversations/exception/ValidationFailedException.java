package com.aigreentick.services.conversations.exception;

import lombok.Getter;

/**
 * Thrown when a question answer fails its validator
 */
@Getter
public class ValidationFailedException extends ConversationServiceException {

    private final String reason;

    public ValidationFailedException(String reason) {
        super("Validation failed: " + reason, "VALIDATION_FAILED");
        this.reason = reason;
    }
}
