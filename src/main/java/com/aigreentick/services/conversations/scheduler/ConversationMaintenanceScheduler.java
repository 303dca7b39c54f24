package com.aigreentick.services.conversations.scheduler;

import com.aigreentick.services.conversations.constants.ConversationConstants;
import com.aigreentick.services.conversations.entity.InboundMessageTask;
import com.aigreentick.services.conversations.repository.InboundMessageTaskRepository;
import com.aigreentick.services.conversations.service.ConversationStateService;
import com.aigreentick.services.conversations.service.ConversationWindowService;
import com.aigreentick.services.conversations.service.InboundMessageWorker;
import com.aigreentick.services.conversations.service.InboundTaskStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * ══════════════════════════════════════════════════════════════════
 * Conversation Maintenance Scheduler
 * ══════════════════════════════════════════════════════════════════
 *
 *   1. Expires customer service windows whose end time has passed
 *   2. Closes conversation sessions nobody touched for a long time
 *   3. Resets inbound tasks stuck in PROCESSING (worker crashed mid-turn)
 *   4. Retries FAILED inbound tasks
 *   5. Re-dispatches PENDING tasks the executor never picked up
 *      (queue rejection, restart between enqueue and dispatch)
 *
 * SCHEDULE
 * ─────────
 *   Window sweep:            every 5 min
 *   Stale session cleanup:   every 60 min
 *   Stuck task reset:        every 10 min
 *   Failed task retry:       every 5 min
 *   Orphaned task dispatch:  every 2 min
 *
 * A window that elapsed between sweeps is already reported EXPIRED by
 * ConversationWindowService.status, so the sweep only tidies stored state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversationMaintenanceScheduler {

    /** PENDING tasks older than this were never picked up */
    private static final int ORPHANED_PENDING_MINUTES = 2;

    private final ConversationWindowService windowService;
    private final ConversationStateService stateService;
    private final InboundMessageTaskRepository taskRepository;
    private final InboundTaskStateService taskStateService;
    private final InboundMessageWorker worker;
    private final Clock clock;

    // ════════════════════════════════════════════════════════════
    // 1. Window sweep
    // ════════════════════════════════════════════════════════════

    @Scheduled(fixedDelay = 5 * 60 * 1000, initialDelay = 60 * 1000)
    public void sweepExpiredWindows() {
        try {
            int expired = windowService.sweepAll();
            if (expired > 0) {
                log.info("Window sweep expired {} conversation windows", expired);
            }
        } catch (Exception ex) {
            log.error("Window sweep failed: {}", ex.getMessage(), ex);
        }
    }

    // ════════════════════════════════════════════════════════════
    // 2. Stale sessions
    // ════════════════════════════════════════════════════════════

    @Scheduled(fixedDelay = 60 * 60 * 1000, initialDelay = 5 * 60 * 1000)
    public void closeStaleSessions() {
        try {
            stateService.deactivateStale();
        } catch (Exception ex) {
            log.error("Stale session cleanup failed: {}", ex.getMessage(), ex);
        }
    }

    // ════════════════════════════════════════════════════════════
    // 3. Stuck task recovery
    // ════════════════════════════════════════════════════════════

    /**
     * PROCESSING for longer than {@link ConversationConstants#STUCK_PROCESSING_MINUTES}
     * means the worker died (OOM kill, pod restart). The turn is replayed from PENDING.
     */
    @Scheduled(fixedDelay = 10 * 60 * 1000)
    public void resetStuckTasks() {
        LocalDateTime threshold = LocalDateTime.now(clock)
                .minusMinutes(ConversationConstants.STUCK_PROCESSING_MINUTES);
        List<InboundMessageTask> stuck = taskRepository.findStuckTasks(threshold);

        int reset = 0;
        for (InboundMessageTask task : stuck) {
            if (taskStateService.resetStuck(task.getId())) {
                worker.dispatch(task.getId());
                reset++;
            }
        }
        if (reset > 0) {
            log.warn("Reset {} stuck inbound tasks back to PENDING", reset);
        }
    }

    // ════════════════════════════════════════════════════════════
    // 4. Failed task retry
    // ════════════════════════════════════════════════════════════

    /**
     * After {@link ConversationConstants#MAX_INBOUND_TASK_RETRIES} failures a task
     * stays FAILED for manual investigation (errorMessage column).
     */
    @Scheduled(fixedDelay = 5 * 60 * 1000)
    public void retryFailedTasks() {
        int maxRetries = ConversationConstants.MAX_INBOUND_TASK_RETRIES;
        List<InboundMessageTask> failed = taskRepository.findRetryableFailures(maxRetries);

        int retried = 0;
        for (InboundMessageTask task : failed) {
            if (taskStateService.claimForRetry(task.getId(), maxRetries)) {
                log.info("Retrying inbound task {} (attempt {})", task.getId(), task.getRetryCount() + 1);
                worker.dispatch(task.getId());
                retried++;
            }
        }
        if (retried > 0) {
            log.info("Queued {} failed inbound tasks for retry", retried);
        }
    }

    // ════════════════════════════════════════════════════════════
    // 5. Orphaned PENDING tasks
    // ════════════════════════════════════════════════════════════

    @Scheduled(fixedDelay = 2 * 60 * 1000)
    public void dispatchOrphanedTasks() {
        LocalDateTime threshold = LocalDateTime.now(clock).minusMinutes(ORPHANED_PENDING_MINUTES);
        List<InboundMessageTask> orphaned = taskRepository.findOrphanedPending(threshold);
        for (InboundMessageTask task : orphaned) {
            worker.dispatch(task.getId());
        }
        if (!orphaned.isEmpty()) {
            log.warn("Re-dispatched {} orphaned PENDING inbound tasks", orphaned.size());
        }
    }
}
