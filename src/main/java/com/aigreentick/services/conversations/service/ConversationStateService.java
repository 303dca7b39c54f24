package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.config.ConversationProperties;
import com.aigreentick.services.conversations.entity.ConversationState;
import com.aigreentick.services.conversations.exception.ConversationPersistenceException;
import com.aigreentick.services.conversations.repository.ConversationStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conversation state store.
 *
 * One row per (organization, contact, flow); re-entering a flow reuses its row.
 * At most one row per contact is active at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationStateService {

    private final ConversationStateRepository stateRepository;
    private final ConversationProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<ConversationState> findActive(Long organizationId, String contactPhone) {
        List<ConversationState> active = stateRepository.findActiveForContact(organizationId, contactPhone);
        if (active.size() > 1) {
            log.warn("{} active states for org={} contact={}, using the most recent",
                    active.size(), organizationId, contactPhone);
        }
        return active.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<ConversationState> find(Long organizationId, String contactPhone, Long flowId) {
        return stateRepository.findByOrganizationIdAndContactPhoneAndFlowId(organizationId, contactPhone, flowId);
    }

    /**
     * True when a turn for this inbound message already committed. Covers
     * conversations that ended or jumped during that turn.
     */
    @Transactional(readOnly = true)
    public boolean isApplied(Long organizationId, String contactPhone, String providerMessageId) {
        return providerMessageId != null
                && stateRepository.existsByOrganizationIdAndContactPhoneAndLastProviderMessageId(
                        organizationId, contactPhone, providerMessageId);
    }

    /**
     * Points the contact's state for {@code flowId} at the entry node, creating
     * the row if needed, and deactivates any other active state of the contact.
     * Changes are written by {@link #save(ConversationState)}.
     */
    @Transactional
    public ConversationState activate(Long organizationId, String contactPhone, Long flowId,
                                      String entryNodeId, Map<String, Object> variables) {
        LocalDateTime now = LocalDateTime.now(clock);

        for (ConversationState other : stateRepository.findActiveForContact(organizationId, contactPhone)) {
            if (!other.getFlowId().equals(flowId)) {
                other.setActive(false);
                other.setUpdatedAt(now);
            }
        }

        ConversationState state = find(organizationId, contactPhone, flowId)
                .orElseGet(() -> ConversationState.builder()
                        .organizationId(organizationId)
                        .contactPhone(contactPhone)
                        .flowId(flowId)
                        .createdAt(now)
                        .build());
        state.setCurrentNodeId(entryNodeId);
        state.setVariables(variables != null ? new LinkedHashMap<>(variables) : new LinkedHashMap<>());
        state.setActive(true);
        state.setQuestionAttempts(0);
        state.setUpdatedAt(now);
        return state;
    }

    /**
     * @throws ObjectOptimisticLockingFailureException when another process changed the row first
     * @throws ConversationPersistenceException on any other storage failure
     */
    @Transactional
    public ConversationState save(ConversationState state) {
        state.setUpdatedAt(LocalDateTime.now(clock));
        try {
            return stateRepository.saveAndFlush(state);
        } catch (ObjectOptimisticLockingFailureException ex) {
            throw ex;
        } catch (DataAccessException ex) {
            throw new ConversationPersistenceException(
                    "Failed to save conversation state for org=" + state.getOrganizationId()
                            + " contact=" + state.getContactPhone(), ex);
        }
    }

    /** Closes sessions nobody has touched for conversation.stale-session-hours */
    @Transactional
    public int deactivateStale() {
        LocalDateTime now = LocalDateTime.now(clock);
        int closed = stateRepository.deactivateStale(now.minusHours(properties.getStaleSessionHours()), now);
        if (closed > 0) {
            log.info("Closed {} stale conversation sessions", closed);
        }
        return closed;
    }
}
