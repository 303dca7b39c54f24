package com.aigreentick.services.conversations.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * A tenant's scripted conversation: a directed graph of FlowNode rows.
 * Authored elsewhere; read-only to the router.
 */
@Entity
@Table(name = "flows", indexes = {
        @Index(name = "idx_flows_org", columnList = "organization_id"),
        @Index(name = "idx_flows_org_main", columnList = "organization_id, is_main")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Flow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "name", nullable = false, length = 150)
    private String name;

    /** nodeKey of the node a fresh conversation starts at */
    @Column(name = "entry_node_id", nullable = false, length = 100)
    private String entryNodeId;

    @Column(name = "is_main", nullable = false)
    @Builder.Default
    private boolean main = false;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    /** Optional keyword that starts this flow when no session is active */
    @Column(name = "trigger_keyword", length = 100)
    private String triggerKeyword;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
