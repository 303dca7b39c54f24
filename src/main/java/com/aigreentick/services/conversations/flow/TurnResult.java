package com.aigreentick.services.conversations.flow;

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of routing one inbound message through a flow.
 */
@Getter
@Builder
public class TurnResult {

    /** Flow the conversation is in after the turn (differs from the start flow after a jump) */
    private final Long flowId;

    private final String currentNodeId;

    private final List<OutboundReply> replies;

    private final Map<String, Object> variables;

    private final boolean terminated;

    /** Node executions performed, jumps included */
    private final int hops;

    public List<String> getResponses() {
        return replies.stream().map(OutboundReply::getText).collect(Collectors.toList());
    }
}
