package com.aigreentick.services.conversations.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes conversation turns for the same contact within this process.
 *
 * One lock per (organization, contact), created on first use and dropped once
 * no thread holds or waits for it. Conversations never share a lock, so a turn
 * that waits on a slow provider call holds up only later messages of the same
 * contact. Across processes the version column on conversation_states rejects
 * the losing write instead.
 */
@Component
public class ConversationLockRegistry {

    private final ConcurrentHashMap<String, KeyedLock> locks = new ConcurrentHashMap<>();

    /** Reentrant: a thread already holding the contact's lock may enter again. */
    public <T> T withLock(Long organizationId, String contactPhone, Supplier<T> action) {
        String key = key(organizationId, contactPhone);
        KeyedLock entry = acquire(key);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(key);
        }
    }

    public boolean isHeldByCurrentThread(Long organizationId, String contactPhone) {
        KeyedLock entry = locks.get(key(organizationId, contactPhone));
        return entry != null && entry.lock.isHeldByCurrentThread();
    }

    /** Conversations with a thread inside or waiting */
    int activeCount() {
        return locks.size();
    }

    // users is only read and written inside compute calls for its key
    private KeyedLock acquire(String key) {
        return locks.compute(key, (k, existing) -> {
            KeyedLock entry = existing != null ? existing : new KeyedLock();
            entry.users++;
            return entry;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private static String key(Long organizationId, String contactPhone) {
        return organizationId + ":" + contactPhone;
    }

    private static final class KeyedLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
