package com.aigreentick.services.conversations.client;

import com.aigreentick.services.conversations.config.ConversationProperties;
import com.aigreentick.services.conversations.exception.DispatchFailedException;
import com.aigreentick.services.conversations.exception.MessagingClientException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DispatchRetryExecutor")
class DispatchRetryExecutorTest {

    private ConversationProperties properties;
    private DispatchRetryExecutor executor;

    @BeforeEach
    void setUp() {
        properties = new ConversationProperties();
        properties.getDispatch().setMaxAttempts(4);
        properties.getDispatch().setBaseDelay(Duration.ofMillis(1));
        properties.getDispatch().setRateLimitDelay(Duration.ofMillis(2));
        properties.getDispatch().setMaxDelay(Duration.ofMillis(5));
        executor = new DispatchRetryExecutor(properties);
    }

    @Test
    @DisplayName("Transient errors are retried until the call succeeds")
    void retriesTransientErrors() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("sendText", "9198", () -> {
            if (calls.incrementAndGet() < 3) {
                throw MessagingClientException.fromStatus(503, "unavailable");
            }
            return "wamid.1";
        });

        assertThat(result).isEqualTo("wamid.1");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Client errors fail immediately")
    void clientErrorIsPermanent() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("sendText", "9198", () -> {
            calls.incrementAndGet();
            throw MessagingClientException.fromStatus(400, "invalid recipient");
        }))
                .isInstanceOf(DispatchFailedException.class)
                .hasMessageContaining("invalid recipient");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Attempts are bounded and the last error is reported")
    void boundedAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("sendText", "9198", () -> {
            calls.incrementAndGet();
            throw MessagingClientException.fromStatus(429, "slow down");
        }))
                .isInstanceOf(DispatchFailedException.class)
                .hasMessageContaining("after 4 attempts")
                .hasCauseInstanceOf(MessagingClientException.class);
        assertThat(calls.get()).isEqualTo(4);
    }

    @Test
    @DisplayName("Unexpected runtime errors are treated as transient")
    void runtimeErrorsAreRetried() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("sendText", "9198", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("connection reset");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
    }

    @Test
    @DisplayName("Backoff doubles per attempt, starts higher for 429 and is capped")
    void backoffSchedule() {
        properties.getDispatch().setBaseDelay(Duration.ofSeconds(1));
        properties.getDispatch().setRateLimitDelay(Duration.ofSeconds(5));
        properties.getDispatch().setMaxDelay(Duration.ofSeconds(30));

        assertThat(executor.backoffMs(1, false)).isEqualTo(1_000);
        assertThat(executor.backoffMs(2, false)).isEqualTo(2_000);
        assertThat(executor.backoffMs(3, false)).isEqualTo(4_000);
        assertThat(executor.backoffMs(1, true)).isEqualTo(5_000);
        assertThat(executor.backoffMs(3, true)).isEqualTo(20_000);
        assertThat(executor.backoffMs(4, true)).isEqualTo(30_000);
        assertThat(executor.backoffMs(40, false)).isEqualTo(30_000);
    }
}
