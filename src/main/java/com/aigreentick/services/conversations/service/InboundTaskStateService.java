package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.constants.ConversationConstants;
import com.aigreentick.services.conversations.entity.InboundMessageTask;
import com.aigreentick.services.conversations.repository.InboundMessageTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Status transitions of inbound message tasks.
 *
 * Every transition is a conditional UPDATE in its own transaction, so it is
 * committed before the worker moves on and two workers can never both win it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboundTaskStateService {

    private final InboundMessageTaskRepository taskRepository;
    private final Clock clock;

    // ════════════════════════════════════════════════════════════
    // CLAIM
    // ════════════════════════════════════════════════════════════

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean tryClaimTask(Long taskId) {
        int updated = taskRepository.claimTaskForProcessing(taskId, LocalDateTime.now(clock));
        if (updated == 0) {
            log.debug("Task {} claim failed, already claimed or finished", taskId);
            return false;
        }
        return true;
    }

    // ════════════════════════════════════════════════════════════
    // TERMINAL TRANSITIONS (only from PROCESSING)
    // ════════════════════════════════════════════════════════════

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markCompleted(Long taskId) {
        int updated = taskRepository.completeTask(taskId, LocalDateTime.now(clock));
        if (updated == 0) {
            log.warn("Task {} completion CAS returned 0, task was reset by the scheduler", taskId);
            return false;
        }
        log.debug("Task {} -> COMPLETED", taskId);
        return true;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(Long taskId, String errorMessage) {
        int updated = taskRepository.failTask(taskId, truncate(errorMessage), LocalDateTime.now(clock));
        if (updated == 0) {
            log.warn("Task {} failure CAS returned 0, task no longer PROCESSING", taskId);
            return false;
        }
        log.info("Task {} -> FAILED: {}", taskId, errorMessage);
        return true;
    }

    /** FAILED without further retries, for errors that would fail the same way again */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailedPermanently(Long taskId, String errorMessage) {
        int updated = taskRepository.failTaskPermanently(taskId, truncate(errorMessage),
                LocalDateTime.now(clock), ConversationConstants.MAX_INBOUND_TASK_RETRIES);
        if (updated == 0) {
            log.warn("Task {} failure CAS returned 0, task no longer PROCESSING", taskId);
            return false;
        }
        log.info("Task {} -> FAILED (not retryable): {}", taskId, errorMessage);
        return true;
    }

    // ════════════════════════════════════════════════════════════
    // RECOVERY
    // ════════════════════════════════════════════════════════════

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean resetStuck(Long taskId) {
        return taskRepository.resetStuckTask(taskId) > 0;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean claimForRetry(Long taskId, int maxRetries) {
        return taskRepository.claimTaskForRetry(taskId, maxRetries) > 0;
    }

    @Transactional(readOnly = true)
    public Optional<InboundMessageTask> load(Long taskId) {
        return taskRepository.findById(taskId);
    }

    @Transactional(readOnly = true)
    public List<InboundMessageTask> pendingForContact(Long organizationId, String contactPhone) {
        return taskRepository.findPendingForContact(organizationId, contactPhone);
    }

    private static String truncate(String message) {
        if (message == null) {
            return "unknown error";
        }
        return message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}
