package com.aigreentick.services.conversations.entity;

import com.aigreentick.services.conversations.constants.MessageKind;
import com.aigreentick.services.conversations.constants.MessageStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One outbound send and its delivery lifecycle.
 * Rows are also the rolling log the per-tenant rate limiter counts.
 */
@Entity
@Table(
        name = "outbound_messages",
        indexes = {
                @Index(name = "idx_outbound_provider_id", columnList = "provider_message_id"),
                @Index(name = "idx_outbound_org_created", columnList = "organization_id, created_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OutboundMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "contact_phone", nullable = false, length = 30)
    private String contactPhone;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_kind", nullable = false, length = 20)
    private MessageKind messageKind;

    @Column(name = "body", columnDefinition = "TEXT")
    private String body;

    @Column(name = "provider_message_id", length = 200)
    private String providerMessageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private MessageStatus status = MessageStatus.PENDING;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
