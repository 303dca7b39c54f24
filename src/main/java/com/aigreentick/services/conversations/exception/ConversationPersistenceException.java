package com.aigreentick.services.conversations.exception;

/**
 * Thrown when conversation state cannot be read or written
 */
public class ConversationPersistenceException extends ConversationServiceException {

    public ConversationPersistenceException(String message, Throwable cause) {
        super(message, "PERSISTENCE_ERROR", cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
