package com.aigreentick.services.conversations.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConversationLockRegistry")
class ConversationLockRegistryTest {

    @Test
    @DisplayName("Turns for one contact never overlap")
    void serializesSameContact() throws Exception {
        ConversationLockRegistry registry = new ConversationLockRegistry();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.withLock(10L, "919800000001", () -> {
                        int current = inside.incrementAndGet();
                        maxInside.accumulateAndGet(current, Math::max);
                        try {
                            Thread.sleep(2);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        inside.decrementAndGet();
                        return null;
                    });
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(registry.activeCount()).isZero();
    }

    @Test
    @DisplayName("A contact stuck on a slow turn does not hold up other contacts")
    void otherContactsProceed() throws Exception {
        ConversationLockRegistry registry = new ConversationLockRegistry();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();

        try {
            Future<?> slow = pool.submit(() -> registry.withLock(10L, "919800000001", () -> {
                holding.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

            for (int i = 0; i < 500; i++) {
                String contact = "91980000" + String.format("%04d", i + 2);
                assertThat(registry.withLock(10L, contact, () -> contact)).isEqualTo(contact);
            }

            release.countDown();
            slow.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Lock is reentrant and dropped once released")
    void reentrantAndReleased() {
        ConversationLockRegistry registry = new ConversationLockRegistry();

        String result = registry.withLock(10L, "919800000001", () -> {
            assertThat(registry.isHeldByCurrentThread(10L, "919800000001")).isTrue();
            return registry.withLock(10L, "919800000001", () -> "done");
        });

        assertThat(result).isEqualTo("done");
        assertThat(registry.isHeldByCurrentThread(10L, "919800000001")).isFalse();
        assertThat(registry.activeCount()).isZero();
    }
}
