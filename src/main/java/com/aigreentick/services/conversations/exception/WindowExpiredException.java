package com.aigreentick.services.conversations.exception;

/**
 * Thrown when a free-form send is attempted after the 24-hour window closed
 */
public class WindowExpiredException extends ConversationServiceException {

    public WindowExpiredException(Long organizationId, String contactPhone) {
        super("24-hour window expired for contact " + contactPhone
                + " in organization " + organizationId + ". Template message required.", "WINDOW_EXPIRED");
    }
}
