package com.aigreentick.services.conversations.repository;

import com.aigreentick.services.conversations.entity.ConversationState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs without the test-managed transaction so every repository call commits
 * on its own, the way two service instances would write the same row.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("ConversationState optimistic locking")
class ConversationStateOptimisticLockTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Autowired
    private ConversationStateRepository repository;

    @AfterEach
    void cleanUp() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("Second writer of the same version is rejected")
    void staleWriteRejected() {
        Long id = repository.saveAndFlush(ConversationState.builder()
                .organizationId(10L)
                .contactPhone("919800000001")
                .flowId(1L)
                .currentNodeId("q1")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build()).getId();

        ConversationState first = repository.findById(id).orElseThrow();
        ConversationState second = repository.findById(id).orElseThrow();

        first.setCurrentNodeId("q2");
        repository.saveAndFlush(first);

        second.setCurrentNodeId("q3");
        assertThatThrownBy(() -> repository.saveAndFlush(second))
                .isInstanceOf(ObjectOptimisticLockingFailureException.class);

        ConversationState stored = repository.findById(id).orElseThrow();
        assertThat(stored.getCurrentNodeId()).isEqualTo("q2");
        assertThat(stored.getVersion()).isEqualTo(1L);
    }
}
