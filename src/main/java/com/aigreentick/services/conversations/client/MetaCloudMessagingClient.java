package com.aigreentick.services.conversations.client;

import com.aigreentick.services.conversations.constants.ConversationConstants;
import com.aigreentick.services.conversations.exception.MessagingClientException;
import com.aigreentick.services.conversations.service.TenantCredentials;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * WhatsApp Cloud API client: POST /{phone-number-id}/messages on the Graph API.
 *
 * Retries live in DispatchRetryExecutor, one level up. This class only
 * classifies failures and sits behind a circuit breaker, so a provider
 * outage fails fast instead of tying up conversation workers.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MetaCloudMessagingClient implements WhatsAppMessagingClient {

    private static final String CB_NAME = "whatsappSend";

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient whatsAppWebClient;

    @Override
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackSend")
    public MessageSendResponse sendText(TenantCredentials channel, String to, String text) {
        Map<String, Object> payload = basePayload(to, "text");
        payload.put("text", Map.of("preview_url", false, "body", text));
        return post(channel, payload);
    }

    @Override
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackSend")
    public MessageSendResponse sendTemplate(TenantCredentials channel, String to, String templateName,
                                            String languageCode, List<Map<String, Object>> components) {
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("name", templateName);
        template.put("language", Map.of("code",
                languageCode != null ? languageCode : ConversationConstants.DEFAULT_TEMPLATE_LANGUAGE));
        if (components != null && !components.isEmpty()) {
            template.put("components", components);
        }

        Map<String, Object> payload = basePayload(to, "template");
        payload.put("template", template);
        return post(channel, payload);
    }

    @Override
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackSend")
    public MessageSendResponse sendInteractive(TenantCredentials channel, String to, String body, List<String> buttons) {
        List<Map<String, Object>> replyButtons = new ArrayList<>();
        for (int i = 0; i < buttons.size(); i++) {
            replyButtons.add(Map.of(
                    "type", "reply",
                    "reply", Map.of("id", "btn_" + (i + 1), "title", buttons.get(i))));
        }

        Map<String, Object> payload = basePayload(to, "interactive");
        payload.put("interactive", Map.of(
                "type", "button",
                "body", Map.of("text", body),
                "action", Map.of("buttons", replyButtons)));
        return post(channel, payload);
    }

    // ───────────────────────────────────────────────────────────
    // PRIVATE HELPERS
    // ───────────────────────────────────────────────────────────

    private Map<String, Object> basePayload(String to, String type) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("messaging_product", ConversationConstants.META_MESSAGING_PRODUCT);
        payload.put("recipient_type", "individual");
        payload.put("to", to);
        payload.put("type", type);
        return payload;
    }

    private MessageSendResponse post(TenantCredentials channel, Map<String, Object> payload) {
        log.debug("Sending {} message via phoneNumberId={}", payload.get("type"), channel.getPhoneNumberId());
        try {
            Map<String, Object> response = whatsAppWebClient.post()
                    .uri("/{phoneNumberId}/messages", channel.getPhoneNumberId())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + channel.getAccessToken())
                    .bodyValue(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, res ->
                            res.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(body -> MessagingClientException.fromStatus(res.statusCode().value(), body)))
                    .bodyToMono(MAP_TYPE)
                    .block();

            MessageSendResponse result = MessageSendResponse.fromGraphResponse(response);
            log.debug("Message accepted: wamid={}", result.getMessageId());
            return result;
        } catch (WebClientRequestException ex) {
            // connect/read timeouts and resets
            throw new MessagingClientException("WhatsApp API unreachable: " + ex.getMessage(), ex);
        }
    }

    private MessageSendResponse fallbackSend(TenantCredentials channel, String to, String text, Throwable ex) {
        return handleFallback(ex);
    }

    private MessageSendResponse fallbackSend(TenantCredentials channel, String to, String body,
                                             List<String> buttons, Throwable ex) {
        return handleFallback(ex);
    }

    private MessageSendResponse fallbackSend(TenantCredentials channel, String to, String templateName,
                                             String languageCode, List<Map<String, Object>> components,
                                             Throwable ex) {
        return handleFallback(ex);
    }

    private MessageSendResponse handleFallback(Throwable ex) {
        if (ex instanceof CallNotPermittedException) {
            log.error("Circuit OPEN for WhatsApp sends, call blocked");
            throw MessagingClientException.serviceUnavailable();
        }
        if (ex instanceof MessagingClientException messagingEx) {
            throw messagingEx;
        }
        throw new MessagingClientException("WhatsApp send failed: " + ex.getMessage(), ex);
    }
}
