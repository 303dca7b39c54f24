package com.aigreentick.services.conversations.exception;

public class NodeTypeUnsupportedException extends ConversationServiceException {

    public NodeTypeUnsupportedException(String typeTag) {
        super("Unsupported node type: " + typeTag, "NODE_TYPE_UNSUPPORTED");
    }
}
