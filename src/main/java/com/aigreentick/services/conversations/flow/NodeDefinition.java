package com.aigreentick.services.conversations.flow;

import com.aigreentick.services.conversations.constants.NodeType;
import com.aigreentick.services.conversations.flow.config.NodeConfig;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A node after load-time parsing: its id, its type and its typed configuration.
 */
@Getter
@RequiredArgsConstructor
public class NodeDefinition {

    private final String nodeId;
    private final NodeType type;
    private final NodeConfig config;

    @SuppressWarnings("unchecked")
    public <T extends NodeConfig> T configAs(Class<T> type) {
        if (!type.isInstance(config)) {
            throw new IllegalStateException("Node " + nodeId + " config is "
                    + config.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return (T) config;
    }
}
