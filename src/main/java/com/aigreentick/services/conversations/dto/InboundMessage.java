package com.aigreentick.services.conversations.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * One contact message extracted from a webhook delivery
 */
@Getter
@Builder
@ToString(exclude = "body")
public class InboundMessage {

    private final Long organizationId;
    private final String phoneNumberId;
    private final String contactPhone;
    private final String contactName;
    private final String providerMessageId;
    private final String messageType;

    /** Text the flow sees: message text, or the title of the tapped button / list row */
    private final String body;

    private final LocalDateTime receivedAt;
}
