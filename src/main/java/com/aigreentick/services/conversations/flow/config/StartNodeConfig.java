package com.aigreentick.services.conversations.flow.config;

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
public class StartNodeConfig implements NodeConfig {

    /** Greeting, optional */
    private String text;

    /** When absent the conversation waits for the contact after the greeting */
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
        // every field is optional
    }
}
