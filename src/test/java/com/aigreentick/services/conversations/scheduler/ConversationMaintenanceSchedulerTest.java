package com.aigreentick.services.conversations.scheduler;

import com.aigreentick.services.conversations.entity.InboundMessageTask;
import com.aigreentick.services.conversations.repository.InboundMessageTaskRepository;
import com.aigreentick.services.conversations.service.ConversationStateService;
import com.aigreentick.services.conversations.service.ConversationWindowService;
import com.aigreentick.services.conversations.service.InboundMessageWorker;
import com.aigreentick.services.conversations.service.InboundTaskStateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConversationMaintenanceScheduler Unit Tests")
class ConversationMaintenanceSchedulerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Mock private ConversationWindowService windowService;
    @Mock private ConversationStateService stateService;
    @Mock private InboundMessageTaskRepository taskRepository;
    @Mock private InboundTaskStateService taskStateService;
    @Mock private InboundMessageWorker worker;

    private ConversationMaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        scheduler = new ConversationMaintenanceScheduler(windowService, stateService,
                taskRepository, taskStateService, worker, clock);
    }

    @Test
    @DisplayName("Window sweep failure is contained")
    void sweepFailureContained() {
        when(windowService.sweepAll()).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> scheduler.sweepExpiredWindows()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Stuck tasks are re-dispatched only when the reset wins")
    void resetsStuckTasks() {
        when(taskRepository.findStuckTasks(NOW.minusMinutes(10)))
                .thenReturn(List.of(task(1L, 0), task(2L, 0)));
        when(taskStateService.resetStuck(1L)).thenReturn(true);
        when(taskStateService.resetStuck(2L)).thenReturn(false);

        scheduler.resetStuckTasks();

        verify(worker).dispatch(1L);
        verify(worker, never()).dispatch(2L);
    }

    @Test
    @DisplayName("Failed tasks under the retry limit are claimed and re-dispatched")
    void retriesFailedTasks() {
        when(taskRepository.findRetryableFailures(3)).thenReturn(List.of(task(7L, 1)));
        when(taskStateService.claimForRetry(7L, 3)).thenReturn(true);

        scheduler.retryFailedTasks();

        verify(worker).dispatch(7L);
    }

    @Test
    @DisplayName("Orphaned PENDING tasks are dispatched again")
    void dispatchesOrphans() {
        when(taskRepository.findOrphanedPending(NOW.minusMinutes(2))).thenReturn(List.of(task(9L, 0)));

        scheduler.dispatchOrphanedTasks();

        verify(worker).dispatch(9L);
    }

    @Test
    @DisplayName("Nothing to recover means nothing dispatched")
    void nothingToRecover() {
        when(taskRepository.findOrphanedPending(NOW.minusMinutes(2))).thenReturn(List.of());

        scheduler.dispatchOrphanedTasks();

        verify(worker, never()).dispatch(anyLong());
    }

    private static InboundMessageTask task(Long id, int retryCount) {
        return InboundMessageTask.builder().id(id).retryCount(retryCount).build();
    }
}
