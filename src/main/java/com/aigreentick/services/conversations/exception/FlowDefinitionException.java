package com.aigreentick.services.conversations.exception;

/**
 * Thrown when stored flow authoring data cannot be turned into a valid graph
 */
public class FlowDefinitionException extends ConversationServiceException {

    public FlowDefinitionException(String message) {
        super(message, "FLOW_DEFINITION_INVALID");
    }

    public FlowDefinitionException(String message, Throwable cause) {
        super(message, "FLOW_DEFINITION_INVALID", cause);
    }

    public static FlowDefinitionException danglingReference(Long flowId, String nodeId, String target) {
        return new FlowDefinitionException(
                "Node " + nodeId + " in flow " + flowId + " points to missing node " + target);
    }
}
