package com.aigreentick.services.conversations.flow;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Where a conversation goes after a node executes.
 *
 *   CONTINUE(nodeId)  : execute nodeId next, in the same turn
 *   AWAITING_INPUT    : stop and wait for the contact's next message
 *   JUMP(flowId)      : continue at the entry node of another flow
 *   TERMINATE         : the conversation is over
 */
@Getter
@EqualsAndHashCode
@ToString
public final class NextStep {

    public enum Kind {
        CONTINUE,
        AWAITING_INPUT,
        JUMP,
        TERMINATE
    }

    private static final NextStep AWAITING_INPUT = new NextStep(Kind.AWAITING_INPUT, null, null);
    private static final NextStep TERMINATE = new NextStep(Kind.TERMINATE, null, null);

    private final Kind kind;
    private final String nodeId;
    private final Long targetFlowId;

    private NextStep(Kind kind, String nodeId, Long targetFlowId) {
        this.kind = kind;
        this.nodeId = nodeId;
        this.targetFlowId = targetFlowId;
    }

    public static NextStep continueTo(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("CONTINUE requires a node id");
        }
        return new NextStep(Kind.CONTINUE, nodeId, null);
    }

    public static NextStep awaitingInput() {
        return AWAITING_INPUT;
    }

    public static NextStep jumpTo(Long flowId) {
        if (flowId == null) {
            throw new IllegalArgumentException("JUMP requires a target flow id");
        }
        return new NextStep(Kind.JUMP, null, flowId);
    }

    public static NextStep terminate() {
        return TERMINATE;
    }

    public boolean isContinue() {
        return kind == Kind.CONTINUE;
    }

    public boolean isAwaitingInput() {
        return kind == Kind.AWAITING_INPUT;
    }

    public boolean isJump() {
        return kind == Kind.JUMP;
    }

    public boolean isTerminate() {
        return kind == Kind.TERMINATE;
    }
}
