package com.aigreentick.services.conversations.constants;

import java.util.Locale;

/**
 * Meta approval status of a message template
 */
public enum TemplateStatus {
    PENDING,
    APPROVED,
    REJECTED,
    PAUSED,
    DISABLED;

    public static TemplateStatus fromEvent(String event) {
        if (event == null || event.isBlank()) return null;
        try {
            return TemplateStatus.valueOf(event.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
