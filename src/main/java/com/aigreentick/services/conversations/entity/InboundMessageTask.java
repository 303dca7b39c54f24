package com.aigreentick.services.conversations.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Durable unit of work for one inbound contact message.
 *
 * The provider message id is the idempotency key: a webhook redelivery of
 * the same message hits the unique constraint and is dropped instead of
 * advancing the conversation twice.
 */
@Entity
@Table(
        name = "inbound_message_tasks",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_inbound_provider_message", columnNames = "provider_message_id")
        },
        indexes = {
                @Index(name = "idx_inbound_status", columnList = "status"),
                @Index(name = "idx_inbound_contact", columnList = "organization_id, contact_phone")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InboundMessageTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "phone_number_id", nullable = false, length = 100)
    private String phoneNumberId;

    @Column(name = "contact_phone", nullable = false, length = 30)
    private String contactPhone;

    @Column(name = "contact_name", length = 150)
    private String contactName;

    @Column(name = "provider_message_id", nullable = false, length = 200)
    private String providerMessageId;

    @Column(name = "message_type", length = 30)
    private String messageType;

    @Column(name = "body", columnDefinition = "TEXT")
    private String body;

    @Column(name = "received_at")
    private LocalDateTime receivedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.PENDING;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public enum Status {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED
    }
}
