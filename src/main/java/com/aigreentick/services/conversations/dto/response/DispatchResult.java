package com.aigreentick.services.conversations.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Outcome of one outbound send. Exactly one of providerMessageId and error is set.
 */
@Getter
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DispatchResult {

    private final boolean success;
    private final String providerMessageId;
    private final String error;
    private final LocalDateTime timestamp;

    private DispatchResult(boolean success, String providerMessageId, String error, LocalDateTime timestamp) {
        this.success = success;
        this.providerMessageId = providerMessageId;
        this.error = error;
        this.timestamp = timestamp;
    }

    public static DispatchResult success(String providerMessageId, LocalDateTime timestamp) {
        return new DispatchResult(true, providerMessageId, null, timestamp);
    }

    public static DispatchResult failed(String error, LocalDateTime timestamp) {
        return new DispatchResult(false, null, error, timestamp);
    }
}
