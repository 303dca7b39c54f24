package com.aigreentick.services.conversations.flow.config;

import com.aigreentick.services.conversations.constants.ConditionOperator;
import com.aigreentick.services.conversations.exception.FlowDefinitionException;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConditionNodeConfig implements NodeConfig {

    private String variable;

    private ConditionOperator operator;

    /** Literal compared against the variable: a scalar, a list, or a comma-separated string */
    private Object value;

    @JsonAlias({"true_node_id", "true_next"})
    private String trueNodeId;

    @JsonAlias({"false_node_id", "false_next"})
    private String falseNodeId;

    @Override
    public List<String> pointers() {
        return Arrays.asList(trueNodeId, falseNodeId);
    }

    @Override
    public void validate(String nodeId) {
        if (variable == null || variable.isBlank()) {
            throw new FlowDefinitionException("Condition node " + nodeId + " has no variable");
        }
        if (operator == null) {
            throw new FlowDefinitionException("Condition node " + nodeId + " has no operator");
        }
        if (trueNodeId == null || trueNodeId.isBlank() || falseNodeId == null || falseNodeId.isBlank()) {
            throw new FlowDefinitionException("Condition node " + nodeId + " needs both a true and a false branch");
        }
    }
}
