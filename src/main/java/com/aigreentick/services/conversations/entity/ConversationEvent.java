package com.aigreentick.services.conversations.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Append-only audit record of a conversation turn or dispatch outcome
 */
@Entity
@Table(name = "conversation_events", indexes = {
        @Index(name = "idx_conv_events_contact", columnList = "organization_id, contact_phone, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "contact_phone", nullable = false, length = 30)
    private String contactPhone;

    @Column(name = "flow_id")
    private Long flowId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40)
    private EventType eventType;

    @Column(name = "node_id", length = 100)
    private String nodeId;

    @Column(name = "detail", columnDefinition = "TEXT")
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public enum EventType {
        MESSAGE_RECEIVED,
        TURN_COMPLETED,
        TURN_FAILED,
        FLOW_JUMPED,
        FLOW_TERMINATED,
        QUESTION_FALLBACK,
        DISPATCH_FAILED
    }
}
