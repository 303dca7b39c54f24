package com.aigreentick.services.conversations.flow.config;

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
public class EndNodeConfig implements NodeConfig {

    /** Closing text, optional */
    private String text;

    @Override
    public List<String> pointers() {
        return List.of();
    }

    @Override
    public void validate(String nodeId) {
        // nothing required
    }
}
