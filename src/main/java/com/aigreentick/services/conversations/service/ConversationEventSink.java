package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.entity.ConversationEvent.EventType;

/**
 * Append-only record of what happened in a conversation.
 * Each event is written in its own transaction and survives a rolled-back turn.
 */
public interface ConversationEventSink {

    void record(EventType type, Long organizationId, String contactPhone, Long flowId, String nodeId, String detail);
}
