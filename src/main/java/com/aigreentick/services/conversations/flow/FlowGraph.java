package com.aigreentick.services.conversations.flow;

import com.aigreentick.services.conversations.exception.FlowDefinitionException;
import lombok.Getter;

import java.util.Map;

/**
 * A flow whose nodes have been parsed and whose references have been checked
 */
@Getter
public class FlowGraph {

    private final Long flowId;
    private final Long organizationId;
    private final String entryNodeId;
    private final Map<String, NodeDefinition> nodes;

    public FlowGraph(Long flowId, Long organizationId, String entryNodeId, Map<String, NodeDefinition> nodes) {
        this.flowId = flowId;
        this.organizationId = organizationId;
        this.entryNodeId = entryNodeId;
        this.nodes = Map.copyOf(nodes);
    }

    public NodeDefinition node(String nodeId) {
        NodeDefinition node = nodes.get(nodeId);
        if (node == null) {
            throw new FlowDefinitionException("Node " + nodeId + " not found in flow " + flowId);
        }
        return node;
    }

    public NodeDefinition entryNode() {
        return node(entryNodeId);
    }

    public boolean contains(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }
}
