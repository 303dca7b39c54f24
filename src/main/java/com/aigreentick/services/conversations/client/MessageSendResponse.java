package com.aigreentick.services.conversations.client;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Accepted send: the provider's message id (wamid), used to match later status webhooks.
 */
@Getter
@AllArgsConstructor
@ToString
public class MessageSendResponse {

    private final String messageId;

    /**
     * Reads {"messages":[{"id":"wamid..."}]} from a Graph API send response.
     */
    @SuppressWarnings("unchecked")
    public static MessageSendResponse fromGraphResponse(Map<String, Object> body) {
        if (body != null && body.get("messages") instanceof List<?> messages && !messages.isEmpty()
                && messages.get(0) instanceof Map<?, ?> first) {
            Object id = ((Map<String, Object>) first).get("id");
            if (id != null) {
                return new MessageSendResponse(String.valueOf(id));
            }
        }
        return new MessageSendResponse(null);
    }
}
