package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.config.ConversationProperties;
import com.aigreentick.services.conversations.constants.MessageKind;
import com.aigreentick.services.conversations.constants.MessageStatus;
import com.aigreentick.services.conversations.entity.OutboundMessage;
import com.aigreentick.services.conversations.exception.RateLimitedException;
import com.aigreentick.services.conversations.repository.OutboundMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-tenant sliding-window send budget.
 *
 * The window is the outbound_messages table itself: a send is allowed when
 * fewer than max-messages rows were created for the organization within the
 * interval, and the allowed send is recorded as a PENDING row in the same
 * transaction. Count and insert run under a per-organization lock that is
 * held until the transaction has committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DispatchRateLimiter {

    private final OutboundMessageRepository outboundRepository;
    private final ConversationProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final Map<Long, ReentrantLock> organizationLocks = new ConcurrentHashMap<>();

    /**
     * @return the PENDING outbound row that holds the reserved slot
     * @throws RateLimitedException when the organization has used its budget
     */
    public OutboundMessage reserve(Long organizationId, String contactPhone, MessageKind kind, String body) {
        ReentrantLock lock = organizationLocks.computeIfAbsent(organizationId, id -> new ReentrantLock());
        lock.lock();
        try {
            return transactionTemplate.execute(status -> {
                ConversationProperties.RateLimit limit = properties.getRateLimit();
                Duration interval = limit.getInterval();
                LocalDateTime now = LocalDateTime.now(clock);

                long used = outboundRepository.countByOrganizationIdAndCreatedAtAfter(
                        organizationId, now.minus(interval));
                if (used >= limit.getMaxMessages()) {
                    log.warn("Rate limit hit: org={}, used={}/{} per {}s",
                            organizationId, used, limit.getMaxMessages(), interval.toSeconds());
                    throw new RateLimitedException(organizationId, limit.getMaxMessages(), interval.toSeconds());
                }

                return outboundRepository.save(OutboundMessage.builder()
                        .organizationId(organizationId)
                        .contactPhone(contactPhone)
                        .messageKind(kind)
                        .body(body)
                        .status(MessageStatus.PENDING)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
            });
        } finally {
            lock.unlock();
        }
    }
}
