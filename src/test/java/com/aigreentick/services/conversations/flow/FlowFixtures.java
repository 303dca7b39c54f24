package com.aigreentick.services.conversations.flow;

import com.aigreentick.services.conversations.constants.ConditionOperator;
import com.aigreentick.services.conversations.constants.NodeType;
import com.aigreentick.services.conversations.constants.ValidationKind;
import com.aigreentick.services.conversations.flow.config.ConditionNodeConfig;
import com.aigreentick.services.conversations.flow.config.EndNodeConfig;
import com.aigreentick.services.conversations.flow.config.JumpNodeConfig;
import com.aigreentick.services.conversations.flow.config.MessageNodeConfig;
import com.aigreentick.services.conversations.flow.config.QuestionNodeConfig;
import com.aigreentick.services.conversations.flow.config.StartNodeConfig;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for in-memory flow graphs used across tests.
 */
public final class FlowFixtures {

    private FlowFixtures() {
    }

    public static NodeDefinition start(String id, String text, String next) {
        return new NodeDefinition(id, NodeType.START,
                StartNodeConfig.builder().text(text).nextNodeId(next).build());
    }

    public static NodeDefinition message(String id, String text, String next, String... buttons) {
        return new NodeDefinition(id, NodeType.MESSAGE, MessageNodeConfig.builder()
                .text(text)
                .nextNodeId(next)
                .buttons(Arrays.asList(buttons))
                .build());
    }

    public static NodeDefinition question(String id, String text, String variable, String next) {
        return question(id, QuestionNodeConfig.builder()
                .text(text)
                .variable(variable)
                .nextNodeId(next)
                .build());
    }

    public static NodeDefinition question(String id, QuestionNodeConfig config) {
        return new NodeDefinition(id, NodeType.QUESTION, config);
    }

    public static QuestionNodeConfig.Validation validation(ValidationKind kind, String... options) {
        return QuestionNodeConfig.Validation.builder()
                .kind(kind)
                .options(List.of(options))
                .build();
    }

    public static NodeDefinition condition(String id, String variable, ConditionOperator operator, Object value,
                                           String whenTrue, String whenFalse) {
        return new NodeDefinition(id, NodeType.CONDITION, ConditionNodeConfig.builder()
                .variable(variable)
                .operator(operator)
                .value(value)
                .trueNodeId(whenTrue)
                .falseNodeId(whenFalse)
                .build());
    }

    public static NodeDefinition jump(String id, Long targetFlowId, boolean carryVariables) {
        return new NodeDefinition(id, NodeType.JUMP, JumpNodeConfig.builder()
                .targetFlowId(targetFlowId)
                .carryVariables(carryVariables)
                .build());
    }

    public static NodeDefinition end(String id, String text) {
        return new NodeDefinition(id, NodeType.END, EndNodeConfig.builder().text(text).build());
    }

    public static FlowGraph graph(Long flowId, Long organizationId, String entryNodeId, NodeDefinition... nodes) {
        Map<String, NodeDefinition> byId = new LinkedHashMap<>();
        for (NodeDefinition node : nodes) {
            byId.put(node.getNodeId(), node);
        }
        return new FlowGraph(flowId, organizationId, entryNodeId, byId);
    }
}
