package com.aigreentick.services.conversations.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tunables for the flow engine, the messaging window and outbound dispatch.
 * Bound from application.yml under prefix "conversation".
 */
@Configuration
@ConfigurationProperties(prefix = "conversation")
@Data
public class ConversationProperties {

    /** Length of the free-messaging window opened by a contact message */
    private int windowHours = 24;

    /** Node executions allowed while handling a single inbound message */
    private int maxHopsPerMessage = 50;

    /** Consecutive invalid answers before a question gives up */
    private int questionMaxAttempts = 3;

    /** Active sessions untouched for this long are closed by the cleanup job */
    private int staleSessionHours = 72;

    private RateLimit rateLimit = new RateLimit();

    private Dispatch dispatch = new Dispatch();

    @Data
    public static class RateLimit {
        /** Messages a tenant may send per rolling interval */
        private int maxMessages = 80;
        private Duration interval = Duration.ofMinutes(1);
    }

    @Data
    public static class Dispatch {
        /** 1 initial attempt + retries */
        private int maxAttempts = 4;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration rateLimitDelay = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofSeconds(30);
    }
}
