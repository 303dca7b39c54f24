package com.aigreentick.services.conversations.exception;

import lombok.Getter;

/**
 * Thrown when one inbound message drives more node executions than allowed.
 * Usually a condition loop with no reachable question or end node.
 */
@Getter
public class FlowCycleDetectedException extends ConversationServiceException {

    private final Long flowId;
    private final String lastNodeId;

    public FlowCycleDetectedException(Long flowId, String lastNodeId, int maxHops) {
        super("Flow " + flowId + " exceeded " + maxHops + " node hops (last node: " + lastNodeId + ")",
                "FLOW_CYCLE_DETECTED");
        this.flowId = flowId;
        this.lastNodeId = lastNodeId;
    }
}
