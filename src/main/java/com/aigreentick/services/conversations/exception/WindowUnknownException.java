package com.aigreentick.services.conversations.exception;

/**
 * Thrown when a free-form send targets a contact that never opened a window
 */
public class WindowUnknownException extends ConversationServiceException {

    public WindowUnknownException(Long organizationId, String contactPhone) {
        super("No conversation window for contact " + contactPhone
                + " in organization " + organizationId + ". Template message required.", "WINDOW_UNKNOWN");
    }
}
