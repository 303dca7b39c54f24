package com.aigreentick.services.conversations.exception;

import lombok.Getter;

/**
 * Thrown when the WhatsApp Cloud API rejects or fails a send.
 *
 * retryable=true  : 5xx, 429, timeouts, circuit open
 * retryable=false: 4xx (bad recipient, invalid token, template mismatch)
 */
@Getter
public class MessagingClientException extends ConversationServiceException {

    private final int httpStatus;
    private final boolean retryable;

    public MessagingClientException(String message, int httpStatus, boolean retryable) {
        super(message, "MESSAGING_API_ERROR");
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public MessagingClientException(String message, Throwable cause) {
        super(message, "MESSAGING_API_ERROR", cause);
        this.httpStatus = 503;
        this.retryable = true;
    }

    public static MessagingClientException fromStatus(int status, String body) {
        boolean transientError = status >= 500 || status == 429;
        return new MessagingClientException(
                "WhatsApp API error (" + status + "): " + body, status, transientError);
    }

    public static MessagingClientException serviceUnavailable() {
        return new MessagingClientException(
                "WhatsApp API is temporarily unavailable. Please try again later.", 503, true);
    }
}
