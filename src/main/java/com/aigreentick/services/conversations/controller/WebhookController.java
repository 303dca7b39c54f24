package com.aigreentick.services.conversations.controller;

import com.aigreentick.services.conversations.config.WhatsAppConfig;
import com.aigreentick.services.conversations.constants.ConversationConstants;
import com.aigreentick.services.conversations.exception.WebhookVerificationException;
import com.aigreentick.services.conversations.service.WebhookService;
import com.aigreentick.services.conversations.service.WebhookSignatureVerifier;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * WhatsApp Cloud API webhook endpoint.
 *
 * Security:
 *   GET  : challenge-response handshake when the webhook URL is registered
 *   POST : X-Hub-Signature-256 HMAC over the raw body, checked before any processing
 *
 * Flow: controller answers 200 at once, WebhookService continues on the
 *       webhook pool and WebhookProcessor handles each item in its own transaction.
 */
@RestController
@RequestMapping(ConversationConstants.API_V1 + "/webhooks")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhooks", description = "WhatsApp Business webhook endpoint")
public class WebhookController {

    private static final Map<String, String> STATUS_OK = Map.of("status", "ok");
    private static final Map<String, String> STATUS_IGNORED = Map.of("status", "ignored");

    private final WebhookService webhookService;
    private final WebhookSignatureVerifier signatureVerifier;
    private final WhatsAppConfig whatsAppConfig;
    private final ObjectMapper objectMapper;

    /**
     * Meta sends hub.* parameters; some proxies strip the prefix, so both forms are read.
     */
    @GetMapping(value = "/whatsapp", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Webhook verification, challenge response")
    public ResponseEntity<String> verifyWebhook(
            @RequestParam(value = "hub.mode", required = false) String hubMode,
            @RequestParam(value = "hub.verify_token", required = false) String hubToken,
            @RequestParam(value = "hub.challenge", required = false) String hubChallenge,
            @RequestParam(value = "mode", required = false) String mode,
            @RequestParam(value = "verify_token", required = false) String token,
            @RequestParam(value = "challenge", required = false) String challenge) {

        String effectiveMode = hubMode != null ? hubMode : mode;
        String effectiveToken = hubToken != null ? hubToken : token;
        String effectiveChallenge = hubChallenge != null ? hubChallenge : challenge;

        log.info("Webhook verification request, mode={}", effectiveMode);

        if (!"subscribe".equals(effectiveMode)) {
            throw WebhookVerificationException.invalidMode(effectiveMode);
        }
        if (effectiveToken == null || !effectiveToken.equals(whatsAppConfig.getWebhookVerifyToken())) {
            log.warn("Webhook verify token mismatch");
            throw WebhookVerificationException.tokenMismatch();
        }

        log.info("Webhook verified");
        return ResponseEntity.ok(effectiveChallenge != null ? effectiveChallenge : "");
    }

    /**
     * The raw body is taken as bytes: the signature is computed over exactly what Meta sent.
     */
    @PostMapping("/whatsapp")
    @Operation(summary = "Receive webhook events (async processing)")
    public ResponseEntity<Map<String, String>> handleWebhookEvent(
            @RequestBody byte[] rawBody,
            @RequestHeader(value = ConversationConstants.SIGNATURE_HEADER, required = false) String signatureHeader) {

        Map<String, Object> payload = parsePayload(rawBody);
        signatureVerifier.authenticate(rawBody, signatureHeader,
                payload != null ? phoneNumberIds(payload) : Set.of());

        if (payload == null) {
            return ResponseEntity.ok(STATUS_IGNORED);
        }
        Object objectType = payload.get("object");
        if (!ConversationConstants.WEBHOOK_OBJECT_WABA.equals(objectType)) {
            log.debug("Ignoring webhook object: {}", objectType);
            return ResponseEntity.ok(STATUS_IGNORED);
        }

        webhookService.processWebhookAsync(payload);
        return ResponseEntity.ok(STATUS_OK);
    }

    // ───────────────────────────────────────────────────────────
    // PRIVATE HELPERS
    // ───────────────────────────────────────────────────────────

    private Map<String, Object> parsePayload(byte[] rawBody) {
        try {
            return objectMapper.readValue(rawBody, new TypeReference<Map<String, Object>>() {});
        } catch (IOException ex) {
            log.warn("Webhook JSON parse error: {}", ex.getMessage());
            return null;
        }
    }

    /** Every entry[].changes[].value.metadata.phone_number_id in the delivery */
    private Set<String> phoneNumberIds(Map<String, Object> payload) {
        Set<String> ids = new LinkedHashSet<>();
        if (!(payload.get("entry") instanceof List<?> entries)) {
            return ids;
        }
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> entryMap) || !(entryMap.get("changes") instanceof List<?> changes)) {
                continue;
            }
            for (Object change : changes) {
                if (change instanceof Map<?, ?> changeMap
                        && changeMap.get("value") instanceof Map<?, ?> value
                        && value.get("metadata") instanceof Map<?, ?> metadata
                        && metadata.get("phone_number_id") != null) {
                    ids.add(String.valueOf(metadata.get("phone_number_id")));
                }
            }
        }
        return ids;
    }
}
