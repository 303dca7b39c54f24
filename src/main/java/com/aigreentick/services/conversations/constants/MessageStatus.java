package com.aigreentick.services.conversations.constants;

import java.util.Locale;

/**
 * Delivery lifecycle of an outbound message.
 * Ordinal order is the forward direction; webhooks may arrive out of order.
 */
public enum MessageStatus {
    PENDING,
    SENT,
    DELIVERED,
    READ,
    FAILED;

    /** FAILED is terminal; otherwise only forward moves are accepted. */
    public boolean canTransitionTo(MessageStatus next) {
        if (this == FAILED || next == null) return false;
        if (next == FAILED) return this != READ;
        return next.ordinal() > this.ordinal();
    }

    public static MessageStatus fromWebhook(String value) {
        if (value == null) return null;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "sent"      -> SENT;
            case "delivered" -> DELIVERED;
            case "read"      -> READ;
            case "failed"    -> FAILED;
            default          -> null;
        };
    }
}
