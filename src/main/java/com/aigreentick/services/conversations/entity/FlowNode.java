package com.aigreentick.services.conversations.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * One authored step of a flow. The type tag and JSON config are stored
 * as written by the editor and parsed into typed configs at load time.
 */
@Entity
@Table(
        name = "flow_nodes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_flow_node_key", columnNames = {"flow_id", "node_key"})
        },
        indexes = {
                @Index(name = "idx_flow_nodes_flow", columnList = "flow_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlowNode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "flow_id", nullable = false)
    private Long flowId;

    @Column(name = "node_key", nullable = false, length = 100)
    private String nodeKey;

    @Column(name = "type_tag", nullable = false, length = 30)
    private String typeTag;

    @Column(name = "config_json", columnDefinition = "TEXT")
    private String configJson;
}
