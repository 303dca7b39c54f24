package com.aigreentick.services.conversations.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Moves webhook processing off the request thread, so Meta gets its 200
 * before any database work happens.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookService {

    private final WebhookProcessor webhookProcessor;

    @Async("webhookTaskExecutor")
    public void processWebhookAsync(Map<String, Object> payload) {
        try {
            int handled = webhookProcessor.process(payload);
            log.debug("Webhook processed: {} items handled", handled);
        } catch (Exception ex) {
            log.error("Failed to process webhook payload: {}", ex.getMessage(), ex);
        }
    }
}
