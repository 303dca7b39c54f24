package com.aigreentick.services.conversations.exception;

import lombok.Getter;

@Getter
public class RateLimitedException extends ConversationServiceException {

    private final Long organizationId;

    public RateLimitedException(Long organizationId, int budget, long intervalSeconds) {
        super("Organization " + organizationId + " exceeded " + budget
                + " messages per " + intervalSeconds + "s", "RATE_LIMITED");
        this.organizationId = organizationId;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
