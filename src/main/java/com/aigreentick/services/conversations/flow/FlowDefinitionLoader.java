package com.aigreentick.services.conversations.flow;

import com.aigreentick.services.conversations.constants.NodeType;
import com.aigreentick.services.conversations.entity.Flow;
import com.aigreentick.services.conversations.entity.FlowNode;
import com.aigreentick.services.conversations.exception.FlowDefinitionException;
import com.aigreentick.services.conversations.exception.FlowNotFoundException;
import com.aigreentick.services.conversations.flow.config.ConditionNodeConfig;
import com.aigreentick.services.conversations.flow.config.EndNodeConfig;
import com.aigreentick.services.conversations.flow.config.JumpNodeConfig;
import com.aigreentick.services.conversations.flow.config.MessageNodeConfig;
import com.aigreentick.services.conversations.flow.config.NodeConfig;
import com.aigreentick.services.conversations.flow.config.QuestionNodeConfig;
import com.aigreentick.services.conversations.flow.config.StartNodeConfig;
import com.aigreentick.services.conversations.repository.FlowNodeRepository;
import com.aigreentick.services.conversations.repository.FlowRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns stored flow rows into a checked FlowGraph.
 *
 * Every node config is parsed into its typed form and every pointer is
 * resolved here, so the router never meets a malformed node mid-conversation.
 * Jump targets must be flows of the same organization.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowDefinitionLoader {

    private final FlowRepository flowRepository;
    private final FlowNodeRepository flowNodeRepository;
    private final ObjectMapper objectMapper;

    public FlowGraph load(Long organizationId, Long flowId) {
        Flow flow = flowRepository.findByIdAndOrganizationId(flowId, organizationId)
                .orElseThrow(() -> FlowNotFoundException.withId(flowId));
        return build(flow, flowNodeRepository.findByFlowId(flowId));
    }

    public FlowGraph build(Flow flow, List<FlowNode> rows) {
        Map<String, NodeDefinition> nodes = new LinkedHashMap<>();
        for (FlowNode row : rows) {
            if (nodes.containsKey(row.getNodeKey())) {
                throw new FlowDefinitionException("Duplicate node " + row.getNodeKey() + " in flow " + flow.getId());
            }
            nodes.put(row.getNodeKey(), parse(flow.getId(), row));
        }

        if (!nodes.containsKey(flow.getEntryNodeId())) {
            throw new FlowDefinitionException(
                    "Entry node " + flow.getEntryNodeId() + " not found in flow " + flow.getId());
        }

        for (NodeDefinition node : nodes.values()) {
            checkPointers(flow, node, nodes);
        }

        log.debug("Loaded flow {} ({} nodes) for organization {}", flow.getId(), nodes.size(), flow.getOrganizationId());
        return new FlowGraph(flow.getId(), flow.getOrganizationId(), flow.getEntryNodeId(), nodes);
    }

    private NodeDefinition parse(Long flowId, FlowNode row) {
        NodeType type = NodeType.fromTag(row.getTypeTag());
        String json = row.getConfigJson() == null || row.getConfigJson().isBlank() ? "{}" : row.getConfigJson();

        NodeConfig config;
        try {
            config = objectMapper.readValue(json, configClass(type));
        } catch (JsonProcessingException e) {
            throw new FlowDefinitionException(
                    "Malformed config for node " + row.getNodeKey() + " in flow " + flowId + ": "
                            + e.getOriginalMessage(), e);
        }
        config.validate(row.getNodeKey());
        return new NodeDefinition(row.getNodeKey(), type, config);
    }

    private static Class<? extends NodeConfig> configClass(NodeType type) {
        return switch (type) {
            case START -> StartNodeConfig.class;
            case MESSAGE -> MessageNodeConfig.class;
            case QUESTION -> QuestionNodeConfig.class;
            case CONDITION -> ConditionNodeConfig.class;
            case JUMP -> JumpNodeConfig.class;
            case END -> EndNodeConfig.class;
        };
    }

    private void checkPointers(Flow flow, NodeDefinition node, Map<String, NodeDefinition> nodes) {
        for (String pointer : node.getConfig().pointers()) {
            NextStep step;
            try {
                step = NextStepCodec.decode(pointer);
            } catch (IllegalArgumentException e) {
                throw new FlowDefinitionException(e.getMessage(), e);
            }
            if (step == null) {
                continue;
            }
            if (step.isContinue() && !nodes.containsKey(step.getNodeId())) {
                throw FlowDefinitionException.danglingReference(flow.getId(), node.getNodeId(), step.getNodeId());
            }
            if (step.isJump()) {
                checkJumpTarget(flow, node, step.getTargetFlowId());
            }
        }
        if (node.getType() == NodeType.JUMP) {
            checkJumpTarget(flow, node, node.configAs(JumpNodeConfig.class).getTargetFlowId());
        }
    }

    private void checkJumpTarget(Flow flow, NodeDefinition node, Long targetFlowId) {
        boolean exists = flowRepository.findByIdAndOrganizationId(targetFlowId, flow.getOrganizationId()).isPresent();
        if (!exists) {
            throw new FlowDefinitionException("Node " + node.getNodeId() + " in flow " + flow.getId()
                    + " jumps to flow " + targetFlowId + " which does not exist for this organization");
        }
    }
}
