package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.dto.InboundMessage;
import com.aigreentick.services.conversations.entity.InboundMessageTask;
import com.aigreentick.services.conversations.repository.InboundMessageTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Durable intake of contact messages.
 *
 * Meta redelivers webhooks it considers unacknowledged, so the provider
 * message id is the idempotency key: a message already queued is not queued again.
 * No surrounding transaction: the insert commits on its own, and a unique key
 * violation from a concurrent redelivery is just a duplicate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboundMessageQueue {

    private final InboundMessageTaskRepository taskRepository;

    /**
     * @return the new task, or empty when the message was already queued
     */
    public Optional<InboundMessageTask> enqueue(InboundMessage message) {
        if (message.getProviderMessageId() != null
                && taskRepository.existsByProviderMessageId(message.getProviderMessageId())) {
            log.debug("Duplicate delivery ignored: wamid={}", message.getProviderMessageId());
            return Optional.empty();
        }

        InboundMessageTask task = InboundMessageTask.builder()
                .organizationId(message.getOrganizationId())
                .phoneNumberId(message.getPhoneNumberId())
                .contactPhone(message.getContactPhone())
                .contactName(message.getContactName())
                .providerMessageId(message.getProviderMessageId())
                .messageType(message.getMessageType())
                .body(message.getBody())
                .receivedAt(message.getReceivedAt())
                .status(InboundMessageTask.Status.PENDING)
                .build();

        try {
            InboundMessageTask saved = taskRepository.saveAndFlush(task);
            log.info("Inbound message queued: taskId={}, org={}, contact={}, type={}",
                    saved.getId(), saved.getOrganizationId(), saved.getContactPhone(), saved.getMessageType());
            return Optional.of(saved);
        } catch (DataIntegrityViolationException ex) {
            // concurrent redelivery won the unique key
            log.debug("Duplicate delivery ignored on insert: wamid={}", message.getProviderMessageId());
            return Optional.empty();
        }
    }
}
