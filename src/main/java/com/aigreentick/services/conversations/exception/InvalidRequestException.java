package com.aigreentick.services.conversations.exception;

/**
 * Thrown for invalid business logic requests
 */
public class InvalidRequestException extends ConversationServiceException {

    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }

    public static InvalidRequestException extensionOutOfRange(int hours, int min, int max) {
        return new InvalidRequestException(
                "Window extension must be between " + min + " and " + max + " hours, got " + hours);
    }
}
