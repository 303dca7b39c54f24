package com.aigreentick.services.conversations.exception;

import lombok.Getter;

/**
 * Base exception for all conversation service exceptions
 */
@Getter
public class ConversationServiceException extends RuntimeException {

    private final String errorCode;

    public ConversationServiceException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ConversationServiceException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Whether the same work may succeed when run again. Flow definition and
     * routing errors are deterministic, so the default is false.
     */
    public boolean isRetryable() {
        return false;
    }
}
