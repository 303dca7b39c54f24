package com.aigreentick.services.conversations.flow.config;

import com.aigreentick.services.conversations.exception.FlowDefinitionException;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JumpNodeConfig implements NodeConfig {

    @JsonAlias({"target_flow_id", "flow_id"})
    private Long targetFlowId;

    /** Copy the collected variables into the target flow's state */
    @Builder.Default
    @JsonAlias("carry_variables")
    private boolean carryVariables = true;

    @Override
    public List<String> pointers() {
        return List.of();
    }

    @Override
    public void validate(String nodeId) {
        if (targetFlowId == null) {
            throw new FlowDefinitionException("Jump node " + nodeId + " has no target flow");
        }
    }
}
