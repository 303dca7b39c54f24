package com.aigreentick.services.conversations.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Position of one contact inside one flow.
 *
 * One row per (organization, contact, flow): the unique constraint is the
 * storage-level guarantee that a key never has two live records. The row
 * is reused (reactivated) when the contact re-enters the flow.
 *
 * The version column makes a turn computed from a stale read fail on save
 * instead of silently overwriting a concurrent turn.
 */
@Entity
@Table(
        name = "conversation_states",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_conversation_state_key",
                        columnNames = {"organization_id", "contact_phone", "flow_id"})
        },
        indexes = {
                @Index(name = "idx_conv_state_contact_active",
                        columnList = "organization_id, contact_phone, is_active"),
                @Index(name = "idx_conv_state_updated", columnList = "is_active, updated_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "contact_phone", nullable = false, length = 30)
    private String contactPhone;

    @Column(name = "flow_id", nullable = false)
    private Long flowId;

    @Column(name = "current_node_id", length = 100)
    private String currentNodeId;

    @Convert(converter = VariablesConverter.class)
    @Column(name = "variables", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> variables = new LinkedHashMap<>();

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    /** Consecutive invalid answers on the current question node */
    @Column(name = "question_attempts", nullable = false)
    @Builder.Default
    private int questionAttempts = 0;

    /** Inbound message whose turn last changed this row; a replayed task with the same id is skipped */
    @Column(name = "last_provider_message_id", length = 200)
    private String lastProviderMessageId;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
