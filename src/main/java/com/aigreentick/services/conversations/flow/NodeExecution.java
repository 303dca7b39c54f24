package com.aigreentick.services.conversations.flow;

import lombok.Getter;

import java.util.Map;

/**
 * Result of executing one node: what to say, where to go, and the
 * variables after the node ran.
 */
@Getter
public class NodeExecution {

    private final OutboundReply reply;
    private final NextStep next;
    private final Map<String, Object> variables;
    private final boolean validationFailed;

    public NodeExecution(OutboundReply reply, NextStep next, Map<String, Object> variables, boolean validationFailed) {
        this.reply = reply;
        this.next = next;
        this.variables = variables;
        this.validationFailed = validationFailed;
    }

    public static NodeExecution of(OutboundReply reply, NextStep next, Map<String, Object> variables) {
        return new NodeExecution(reply, next, variables, false);
    }

    public static NodeExecution invalidAnswer(OutboundReply reply, Map<String, Object> variables) {
        return new NodeExecution(reply, NextStep.awaitingInput(), variables, true);
    }

    public String getResponseText() {
        return reply != null ? reply.getText() : null;
    }
}
