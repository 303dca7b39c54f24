package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.entity.InboundMessageTask;
import com.aigreentick.services.conversations.exception.ConversationPersistenceException;
import com.aigreentick.services.conversations.exception.FlowNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("InboundMessageWorker Unit Tests")
class InboundMessageWorkerTest {

    @Mock
    private InboundTaskStateService taskStateService;

    @Mock
    private InboundMessageHandler messageHandler;

    private InboundMessageWorker worker;

    private final InboundMessageTask task = InboundMessageTask.builder()
            .id(7L).organizationId(10L).contactPhone("9198").body("hi").build();

    @BeforeEach
    void setUp() {
        worker = new InboundMessageWorker(taskStateService, messageHandler, new ConversationLockRegistry());
    }

    @Test
    @DisplayName("Claimed task is handled and completed")
    void handlesClaimedTask() {
        when(taskStateService.load(7L)).thenReturn(Optional.of(task));
        when(taskStateService.pendingForContact(10L, "9198")).thenReturn(List.of(task));
        when(taskStateService.tryClaimTask(7L)).thenReturn(true);
        when(taskStateService.markCompleted(7L)).thenReturn(true);

        assertThat(worker.process(7L)).isTrue();
        verify(messageHandler).handle(task);
    }

    @Test
    @DisplayName("Older pending message of the same contact runs first")
    void olderMessageRunsFirst() {
        InboundMessageTask older = InboundMessageTask.builder()
                .id(6L).organizationId(10L).contactPhone("9198").body("first").build();
        when(taskStateService.load(7L)).thenReturn(Optional.of(task));
        when(taskStateService.pendingForContact(10L, "9198")).thenReturn(List.of(older, task));
        when(taskStateService.tryClaimTask(anyLong())).thenReturn(true);
        when(taskStateService.markCompleted(anyLong())).thenReturn(true);

        assertThat(worker.process(7L)).isTrue();

        InOrder order = inOrder(messageHandler, taskStateService);
        order.verify(messageHandler).handle(older);
        order.verify(taskStateService).markCompleted(6L);
        order.verify(messageHandler).handle(task);
        order.verify(taskStateService).markCompleted(7L);
    }

    @Test
    @DisplayName("Task that is no longer PENDING is skipped without locking")
    void skipsNonPendingTask() {
        InboundMessageTask done = InboundMessageTask.builder()
                .id(7L).organizationId(10L).contactPhone("9198")
                .status(InboundMessageTask.Status.COMPLETED).build();
        when(taskStateService.load(7L)).thenReturn(Optional.of(done));

        assertThat(worker.process(7L)).isFalse();
        verify(taskStateService, never()).tryClaimTask(anyLong());
        verifyNoInteractions(messageHandler);
    }

    @Test
    @DisplayName("Task claimed elsewhere is skipped")
    void skipsUnclaimedTask() {
        when(taskStateService.load(7L)).thenReturn(Optional.of(task));
        when(taskStateService.pendingForContact(10L, "9198")).thenReturn(List.of(task));
        when(taskStateService.tryClaimTask(7L)).thenReturn(false);

        assertThat(worker.process(7L)).isFalse();
        verify(messageHandler, never()).handle(any());
    }

    @Test
    @DisplayName("Task already drained by the lock holder returns false")
    void drainedByAnotherThread() {
        when(taskStateService.load(7L)).thenReturn(Optional.of(task));
        when(taskStateService.pendingForContact(10L, "9198")).thenReturn(List.of());

        assertThat(worker.process(7L)).isFalse();
        verifyNoInteractions(messageHandler);
    }

    @Test
    @DisplayName("Missing flow fails the task with no retries left")
    void nonRetryableFailureIsTerminal() {
        when(taskStateService.load(7L)).thenReturn(Optional.of(task));
        when(taskStateService.pendingForContact(10L, "9198")).thenReturn(List.of(task));
        when(taskStateService.tryClaimTask(7L)).thenReturn(true);
        when(messageHandler.handle(task)).thenThrow(FlowNotFoundException.noMainFlow(10L));
        when(taskStateService.markFailedPermanently(eq(7L), contains("10"))).thenReturn(true);

        assertThat(worker.process(7L)).isFalse();
        verify(taskStateService, never()).markFailed(anyLong(), anyString());
        verify(taskStateService, never()).markCompleted(anyLong());
    }

    @Test
    @DisplayName("Persistence failure leaves the task retryable")
    void retryableFailure() {
        when(taskStateService.load(7L)).thenReturn(Optional.of(task));
        when(taskStateService.pendingForContact(10L, "9198")).thenReturn(List.of(task));
        when(taskStateService.tryClaimTask(7L)).thenReturn(true);
        when(messageHandler.handle(task))
                .thenThrow(new ConversationPersistenceException("write lost", new RuntimeException("boom")));
        when(taskStateService.markFailed(7L, "write lost")).thenReturn(true);

        assertThat(worker.process(7L)).isFalse();
        verify(taskStateService, never()).markFailedPermanently(anyLong(), anyString());
    }

    @Test
    @DisplayName("Unexpected failure leaves the task retryable")
    void unexpectedFailure() {
        when(taskStateService.load(7L)).thenReturn(Optional.of(task));
        when(taskStateService.pendingForContact(10L, "9198")).thenReturn(List.of(task));
        when(taskStateService.tryClaimTask(7L)).thenReturn(true);
        when(messageHandler.handle(task)).thenThrow(new IllegalStateException("db down"));
        when(taskStateService.markFailed(7L, "db down")).thenReturn(true);

        assertThat(worker.process(7L)).isFalse();
        verify(taskStateService, never()).markFailedPermanently(anyLong(), anyString());
    }
}
