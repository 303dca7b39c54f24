package com.aigreentick.services.conversations.exception;

/**
 * Thrown when the X-Hub-Signature-256 header is missing, malformed or does not match
 */
public class SignatureInvalidException extends ConversationServiceException {

    public SignatureInvalidException(String message) {
        super(message, "SIGNATURE_INVALID");
    }
}
