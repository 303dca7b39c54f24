package com.aigreentick.services.conversations.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Thread pool configuration for async tasks.
 *
 * webhookTaskExecutor (used by WebhookService)
 * ─────────────────────────────────────────────
 * Parses envelopes, applies status updates and enqueues inbound messages.
 * Only DB writes, no provider I/O.
 *
 * conversationTaskExecutor (used by InboundMessageWorker)
 * ────────────────────────────────────────────────────────
 * Runs a conversation turn and dispatches replies (provider HTTP calls
 * with retry backoff). Separate pool so slow sends cannot starve intake.
 * Work is durable in inbound_message_tasks, so a full queue or a restart
 * only delays it until the maintenance scheduler re-dispatches.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    @Bean(name = "webhookTaskExecutor")
    public Executor webhookTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(5);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("wa-webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "conversationTaskExecutor")
    public Executor conversationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("wa-conversation-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /** Single time source so window and session arithmetic can be tested */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
