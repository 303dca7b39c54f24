package com.aigreentick.services.conversations.constants;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Answer validators available to question nodes
 */
public enum ValidationKind {
    TEXT,
    EMAIL,
    PHONE,
    NUMBER,
    CHOICE;

    @JsonCreator
    public static ValidationKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "text", "free_text" -> TEXT;
            case "email"             -> EMAIL;
            case "phone"             -> PHONE;
            case "number", "numeric" -> NUMBER;
            case "choice", "options" -> CHOICE;
            default -> throw new IllegalArgumentException("Unknown validation kind: " + value);
        };
    }
}
