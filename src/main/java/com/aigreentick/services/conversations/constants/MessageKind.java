package com.aigreentick.services.conversations.constants;

public enum MessageKind {
    TEXT,
    TEMPLATE,
    INTERACTIVE
}
