package com.aigreentick.services.conversations.client;

import com.aigreentick.services.conversations.config.ConversationProperties;
import com.aigreentick.services.conversations.exception.DispatchFailedException;
import com.aigreentick.services.conversations.exception.MessagingClientException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff around provider sends.
 *
 * RETRY STRATEGY (defaults, see conversation.dispatch.*)
 * ──────────────────────────────────────────────────────
 * Attempt 1 → immediate
 * Attempt 2 → wait 1s
 * Attempt 3 → wait 2s
 * Attempt 4 → wait 4s, then give up
 *
 * HTTP 429 waits from a 5s base instead. Every wait is capped at 30s.
 *
 * WHAT IS RETRYABLE
 * ─────────────────
 *   5xx, 429, timeouts, connection resets, open circuit
 *   Not 4xx: a bad request or revoked token fails the same way every time
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DispatchRetryExecutor {

    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final ConversationProperties properties;

    /**
     * @param operation  name for logs, e.g. "sendText"
     * @param recipient  contact the message is for, for logs
     * @throws DispatchFailedException on a permanent error or once attempts run out
     */
    public <T> T execute(String operation, String recipient, Supplier<T> call) {
        ConversationProperties.Dispatch config = properties.getDispatch();
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        String context = operation + "[" + recipient + "]";
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                T result = call.get();
                if (attempt > 1) {
                    log.info("{} succeeded after {} attempts", context, attempt);
                }
                return result;
            } catch (MessagingClientException ex) {
                if (!ex.isRetryable()) {
                    log.error("{} failed permanently (attempt {}/{}): status={}, msg={}",
                            context, attempt, maxAttempts, ex.getHttpStatus(), ex.getMessage());
                    throw new DispatchFailedException(context + " failed: " + ex.getMessage(), ex);
                }
                lastError = ex;
                if (attempt < maxAttempts) {
                    log.warn("{} got retryable error (attempt {}/{}): status={}. Retrying...",
                            context, attempt, maxAttempts, ex.getHttpStatus());
                    sleep(backoffMs(attempt, ex.getHttpStatus() == HTTP_TOO_MANY_REQUESTS), context, attempt);
                }
            } catch (DispatchFailedException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                lastError = ex;
                if (attempt < maxAttempts) {
                    log.warn("{} threw exception (attempt {}/{}): {}. Retrying...",
                            context, attempt, maxAttempts, ex.getMessage());
                    sleep(backoffMs(attempt, false), context, attempt);
                }
            }
        }

        log.error("{} exhausted all {} attempts. Last error: {}", context, maxAttempts,
                lastError != null ? lastError.getMessage() : "none");
        throw new DispatchFailedException(context + " failed after " + maxAttempts + " attempts: "
                + (lastError != null ? lastError.getMessage() : "unknown error"), lastError);
    }

    /**
     * base * 2^(attempt-1), capped.
     */
    long backoffMs(int attempt, boolean rateLimited) {
        ConversationProperties.Dispatch config = properties.getDispatch();
        long base = rateLimited ? config.getRateLimitDelay().toMillis() : config.getBaseDelay().toMillis();
        long delay = base * (1L << Math.min(attempt - 1, 20));
        return Math.min(delay, config.getMaxDelay().toMillis());
    }

    private void sleep(long ms, String context, int attempt) {
        if (ms <= 0) {
            return;
        }
        try {
            log.debug("{} waiting {}ms before attempt {}", context, ms, attempt + 1);
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new DispatchFailedException(context + " interrupted during retry backoff", ie);
        }
    }
}
