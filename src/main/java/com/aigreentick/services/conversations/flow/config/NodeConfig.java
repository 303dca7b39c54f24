package com.aigreentick.services.conversations.flow.config;

import java.util.List;

/**
 * Typed configuration of one node, parsed from the stored JSON when a flow is loaded.
 */
public interface NodeConfig {

    /**
     * Raw next-node pointers as authored. Each is a node id, a jump marker or
     * an end marker, and is decoded by the loader.
     */
    List<String> pointers();

    /**
     * Checks required fields.
     *
     * @throws com.aigreentick.services.conversations.exception.FlowDefinitionException when a field is missing
     */
    void validate(String nodeId);
}
