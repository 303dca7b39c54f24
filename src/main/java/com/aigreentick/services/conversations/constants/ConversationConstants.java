package com.aigreentick.services.conversations.constants;

/**
 * Application-wide constants for the conversation service
 */
public final class ConversationConstants {

    private ConversationConstants() {
        throw new IllegalStateException("Constants class cannot be instantiated");
    }

    // API Versioning
    public static final String API_V1 = "/api/v1";

    // Webhook
    public static final String WEBHOOK_OBJECT_WABA = "whatsapp_business_account";
    public static final String FIELD_MESSAGES = "messages";
    public static final String FIELD_TEMPLATE_STATUS_UPDATE = "message_template_status_update";
    public static final String SIGNATURE_HEADER = "X-Hub-Signature-256";
    public static final String SIGNATURE_PREFIX = "sha256=";

    // Meta API Constants
    public static final String META_MESSAGING_PRODUCT = "whatsapp";
    public static final String DEFAULT_TEMPLATE_LANGUAGE = "en_US";

    // WhatsApp limits interactive reply buttons to three per message
    public static final int MAX_INTERACTIVE_BUTTONS = 3;
    public static final int MAX_BUTTON_TITLE_LENGTH = 20;

    // Window override bounds (hours)
    public static final int MIN_WINDOW_EXTENSION_HOURS = 1;
    public static final int MAX_WINDOW_EXTENSION_HOURS = 168;

    // Inbound task retry
    public static final int MAX_INBOUND_TASK_RETRIES = 3;
    public static final int STUCK_PROCESSING_MINUTES = 10;

    // Optimistic-lock retries for one conversation turn
    public static final int MAX_TURN_ATTEMPTS = 3;

    // Default reply when a question answer fails validation
    public static final String DEFAULT_VALIDATION_ERROR = "Invalid answer, please try again.";
}
