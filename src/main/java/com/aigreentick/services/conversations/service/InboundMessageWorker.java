package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.entity.InboundMessageTask;
import com.aigreentick.services.conversations.exception.ConversationServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Executes queued inbound messages on the conversation pool.
 *
 * Tasks are claimed only while holding the contact's conversation lock, and
 * the holder works through that contact's PENDING tasks oldest message first.
 * A task that reaches the pool ahead of an older one from the same contact
 * therefore still runs after it.
 *
 * tryClaimTask is an atomic UPDATE ... WHERE status = 'PENDING'. When the
 * same task is dispatched twice (webhook path and scheduler re-dispatch),
 * exactly one thread claims it and the other exits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboundMessageWorker {

    private final InboundTaskStateService taskStateService;
    private final InboundMessageHandler messageHandler;
    private final ConversationLockRegistry lockRegistry;

    @Async("conversationTaskExecutor")
    public void dispatch(Long taskId) {
        process(taskId);
    }

    /**
     * Synchronous body of {@link #dispatch(Long)}.
     *
     * @return true when this call claimed and completed the task
     */
    public boolean process(Long taskId) {
        Optional<InboundMessageTask> task = taskStateService.load(taskId);
        if (task.isEmpty()) {
            log.warn("Task {} not found", taskId);
            return false;
        }
        InboundMessageTask own = task.get();
        if (own.getStatus() != InboundMessageTask.Status.PENDING) {
            log.debug("Task {} is {}, thread [{}] exiting", taskId, own.getStatus(), Thread.currentThread().getName());
            return false;
        }

        return lockRegistry.withLock(own.getOrganizationId(), own.getContactPhone(), () -> {
            for (InboundMessageTask next : taskStateService.pendingForContact(
                    own.getOrganizationId(), own.getContactPhone())) {
                boolean completed = runClaimed(next);
                if (next.getId().equals(taskId)) {
                    return completed;
                }
            }
            log.debug("Task {} was taken by another thread", taskId);
            return false;
        });
    }

    private boolean runClaimed(InboundMessageTask task) {
        Long taskId = task.getId();
        if (!taskStateService.tryClaimTask(taskId)) {
            log.debug("Task {} already claimed, thread [{}] skipping", taskId, Thread.currentThread().getName());
            return false;
        }

        try {
            messageHandler.handle(task);
            return taskStateService.markCompleted(taskId);
        } catch (Exception ex) {
            // a broken flow fails the same way on every replay
            boolean permanent = ex instanceof ConversationServiceException serviceEx && !serviceEx.isRetryable();
            boolean recorded = permanent
                    ? taskStateService.markFailedPermanently(taskId, ex.getMessage())
                    : taskStateService.markFailed(taskId, ex.getMessage());
            if (recorded) {
                log.error("Task {} FAILED{}: org={}, contact={}: {}", taskId, permanent ? " (not retryable)" : "",
                        task.getOrganizationId(), task.getContactPhone(), ex.getMessage(), ex);
            } else {
                log.warn("Task {} failed but is no longer PROCESSING. Error was: {}", taskId, ex.getMessage());
            }
            return false;
        }
    }
}
