package com.aigreentick.services.conversations.exception;

public class FlowNotFoundException extends ConversationServiceException {

    public FlowNotFoundException(String message) {
        super(message, "FLOW_NOT_FOUND");
    }

    public static FlowNotFoundException withId(Long flowId) {
        return new FlowNotFoundException("Flow not found with ID: " + flowId);
    }

    public static FlowNotFoundException noMainFlow(Long organizationId) {
        return new FlowNotFoundException("No active main flow for organization " + organizationId);
    }
}
