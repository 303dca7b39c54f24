package com.aigreentick.services.conversations.flow.config;

import com.aigreentick.services.conversations.exception.FlowDefinitionException;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageNodeConfig implements NodeConfig {

    private String text;

    @Builder.Default
    private List<String> buttons = new ArrayList<>();

    @JsonAlias({"next_node_id", "next"})
    private String nextNodeId;

    @Override
    public List<String> pointers() {
        List<String> pointers = new ArrayList<>();
        if (nextNodeId != null) {
            pointers.add(nextNodeId);
        }
        return pointers;
    }

    @Override
    public void validate(String nodeId) {
        if (text == null || text.isBlank()) {
            throw new FlowDefinitionException("Message node " + nodeId + " has no text");
        }
        if (buttons != null && buttons.stream().anyMatch(b -> b == null || b.isBlank())) {
            throw new FlowDefinitionException("Message node " + nodeId + " has a blank button label");
        }
    }
}
