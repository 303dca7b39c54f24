package com.aigreentick.services.conversations.exception;

public class TemplateNotApprovedException extends ConversationServiceException {

    public TemplateNotApprovedException(String templateName, String status) {
        super("Template '" + templateName + "' is not approved (status: " + status + ")",
                "TEMPLATE_NOT_APPROVED");
    }
}
