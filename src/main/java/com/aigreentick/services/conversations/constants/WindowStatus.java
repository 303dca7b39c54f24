package com.aigreentick.services.conversations.constants;

/**
 * 24-hour customer service window states.
 * UNKNOWN is never persisted; it means no window row exists yet.
 */
public enum WindowStatus {
    UNKNOWN,
    ACTIVE,
    MANUALLY_EXTENDED,
    EXPIRED;

    /** Free-form messages are allowed in both ACTIVE and MANUALLY_EXTENDED */
    public boolean allowsFreeMessages() {
        return this == ACTIVE || this == MANUALLY_EXTENDED;
    }
}
