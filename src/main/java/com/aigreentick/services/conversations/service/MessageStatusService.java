package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.constants.MessageStatus;
import com.aigreentick.services.conversations.repository.OutboundMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Applies delivery receipts (sent / delivered / read / failed) to outbound messages.
 * Receipts can arrive late, twice or out of order; a receipt that would move a
 * message backwards is ignored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageStatusService {

    private final OutboundMessageRepository outboundRepository;
    private final Clock clock;

    /**
     * @return true when the stored status changed
     */
    @Transactional
    public boolean apply(String providerMessageId, String rawStatus, String error) {
        MessageStatus next = MessageStatus.fromWebhook(rawStatus);
        if (next == null) {
            log.debug("Unknown delivery status '{}' for wamid={}", rawStatus, providerMessageId);
            return false;
        }

        return outboundRepository.findByProviderMessageId(providerMessageId)
                .map(message -> {
                    if (!message.getStatus().canTransitionTo(next)) {
                        log.debug("Ignoring status {} for wamid={} (currently {})",
                                next, providerMessageId, message.getStatus());
                        return false;
                    }
                    message.setStatus(next);
                    message.setUpdatedAt(LocalDateTime.now(clock));
                    if (next == MessageStatus.FAILED) {
                        message.setErrorMessage(error);
                        log.warn("Delivery failed: wamid={}, org={}, error={}",
                                providerMessageId, message.getOrganizationId(), error);
                    }
                    outboundRepository.save(message);
                    return true;
                })
                .orElseGet(() -> {
                    log.debug("Status for unknown wamid={} ignored", providerMessageId);
                    return false;
                });
    }
}
