package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.constants.ConversationConstants;
import com.aigreentick.services.conversations.dto.InboundMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a WhatsApp Business webhook envelope and hands each item to its handler.
 *
 * Handled fields:
 * - messages:                        contact messages and delivery receipts
 * - message_template_status_update:  template review decisions
 *
 * Every message, receipt and template update is handled on its own, in its
 * own transaction. One bad item is logged and skipped; the rest of the
 * delivery is still processed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookProcessor {

    private final TenantCredentialResolver credentialResolver;
    private final InboundMessageQueue inboundQueue;
    private final InboundMessageWorker inboundWorker;
    private final MessageStatusService messageStatusService;
    private final TemplateStatusService templateStatusService;
    private final Clock clock;

    /**
     * @return number of items handled successfully
     */
    public int process(Map<String, Object> payload) {
        String objectType = String.valueOf(payload.getOrDefault("object", ""));
        if (!ConversationConstants.WEBHOOK_OBJECT_WABA.equals(objectType)) {
            log.debug("Ignoring non-WABA webhook object: {}", objectType);
            return 0;
        }

        List<Map<String, Object>> entries = extractList(payload, "entry");
        if (entries == null || entries.isEmpty()) {
            log.warn("Webhook received with no entries");
            return 0;
        }

        int handled = 0;
        for (Map<String, Object> entry : entries) {
            List<Map<String, Object>> changes = extractList(entry, "changes");
            if (changes == null) {
                continue;
            }
            for (Map<String, Object> change : changes) {
                String field = String.valueOf(change.getOrDefault("field", ""));
                Map<String, Object> value = extractMap(change, "value");
                if (value == null) {
                    log.warn("Webhook change has no value: field={}", field);
                    continue;
                }
                switch (field) {
                    case ConversationConstants.FIELD_MESSAGES -> handled += handleMessagesChange(value);
                    case ConversationConstants.FIELD_TEMPLATE_STATUS_UPDATE -> handled += handleTemplateChange(value);
                    default -> log.debug("Unhandled webhook field: {}", field);
                }
            }
        }
        return handled;
    }

    // ========================
    // messages
    // ========================

    private int handleMessagesChange(Map<String, Object> value) {
        int handled = 0;
        Map<String, Object> metadata = extractMap(value, "metadata");
        String phoneNumberId = metadata != null ? asString(metadata.get("phone_number_id")) : null;

        List<Map<String, Object>> statuses = extractList(value, "statuses");
        if (statuses != null) {
            for (Map<String, Object> status : statuses) {
                try {
                    if (messageStatusService.apply(asString(status.get("id")), asString(status.get("status")),
                            firstErrorTitle(status))) {
                        handled++;
                    }
                } catch (Exception ex) {
                    log.error("Failed to apply status for wamid={}: {}", status.get("id"), ex.getMessage(), ex);
                }
            }
        }

        List<Map<String, Object>> messages = extractList(value, "messages");
        if (messages == null || messages.isEmpty()) {
            return handled;
        }

        Optional<Long> organizationId = credentialResolver.resolveByPhoneNumberId(phoneNumberId)
                .map(TenantCredentials::getOrganizationId);
        if (organizationId.isEmpty()) {
            log.warn("Dropping {} messages for unknown phoneNumberId={}", messages.size(), phoneNumberId);
            return handled;
        }

        Map<String, String> contactNames = contactNames(value);
        for (Map<String, Object> message : messages) {
            try {
                InboundMessage inbound = toInboundMessage(organizationId.get(), phoneNumberId, message, contactNames);
                if (inbound.getContactPhone() == null) {
                    log.warn("Message without sender ignored: wamid={}", inbound.getProviderMessageId());
                    continue;
                }
                inboundQueue.enqueue(inbound).ifPresent(task -> inboundWorker.dispatch(task.getId()));
                handled++;
            } catch (Exception ex) {
                log.error("Failed to queue message wamid={}: {}", message.get("id"), ex.getMessage(), ex);
            }
        }
        return handled;
    }

    private InboundMessage toInboundMessage(Long organizationId, String phoneNumberId,
                                            Map<String, Object> message, Map<String, String> contactNames) {
        String from = asString(message.get("from"));
        String type = String.valueOf(message.getOrDefault("type", "unknown"));
        return InboundMessage.builder()
                .organizationId(organizationId)
                .phoneNumberId(phoneNumberId)
                .contactPhone(from)
                .contactName(contactNames.get(from))
                .providerMessageId(asString(message.get("id")))
                .messageType(type)
                .body(extractBody(type, message))
                .receivedAt(toLocalDateTime(message.get("timestamp")))
                .build();
    }

    private String extractBody(String type, Map<String, Object> message) {
        return switch (type) {
            case "text" -> nested(message, "text", "body");
            case "button" -> nested(message, "button", "text");
            case "interactive" -> {
                String button = nested(extractMap(message, "interactive"), "button_reply", "title");
                yield button != null ? button : nested(extractMap(message, "interactive"), "list_reply", "title");
            }
            case "image", "video", "document" -> nested(message, type, "caption");
            default -> null;
        };
    }

    private Map<String, String> contactNames(Map<String, Object> value) {
        Map<String, String> names = new HashMap<>();
        List<Map<String, Object>> contacts = extractList(value, "contacts");
        if (contacts != null) {
            for (Map<String, Object> contact : contacts) {
                String waId = asString(contact.get("wa_id"));
                String name = nested(contact, "profile", "name");
                if (waId != null && name != null) {
                    names.put(waId, name);
                }
            }
        }
        return names;
    }

    // ========================
    // message_template_status_update
    // ========================

    private int handleTemplateChange(Map<String, Object> value) {
        List<Map<String, Object>> updates = extractList(value, "message_templates");
        if (updates == null) {
            updates = List.of(value);
        }

        int handled = 0;
        for (Map<String, Object> update : updates) {
            try {
                if (templateStatusService.apply(
                        asString(update.get("message_template_id")),
                        asString(update.get("message_template_name")),
                        asString(update.get("event")),
                        asString(update.get("reason")))) {
                    handled++;
                }
            } catch (Exception ex) {
                log.error("Failed to apply template update {}: {}",
                        update.get("message_template_id"), ex.getMessage(), ex);
            }
        }
        return handled;
    }

    // ========================
    // SAFE CAST HELPERS
    // ========================

    private LocalDateTime toLocalDateTime(Object epochSeconds) {
        if (epochSeconds != null) {
            try {
                long seconds = Long.parseLong(String.valueOf(epochSeconds));
                return LocalDateTime.ofInstant(Instant.ofEpochSecond(seconds), clock.getZone());
            } catch (NumberFormatException ex) {
                log.debug("Unparseable message timestamp: {}", epochSeconds);
            }
        }
        return LocalDateTime.now(clock);
    }

    private String firstErrorTitle(Map<String, Object> status) {
        List<Map<String, Object>> errors = extractList(status, "errors");
        if (errors == null || errors.isEmpty()) {
            return null;
        }
        Object title = errors.get(0).get("title");
        return title != null ? String.valueOf(title) : asString(errors.get(0).get("message"));
    }

    private String nested(Map<String, Object> map, String key, String field) {
        Map<String, Object> inner = map != null ? extractMap(map, key) : null;
        return inner != null ? asString(inner.get(field)) : null;
    }

    private static String asString(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> extractList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return (List<Map<String, Object>>) list;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> extractMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map<?, ?> m) {
            return (Map<String, Object>) m;
        }
        return null;
    }
}
