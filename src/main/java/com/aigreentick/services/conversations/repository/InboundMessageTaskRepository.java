package com.aigreentick.services.conversations.repository;

import com.aigreentick.services.conversations.entity.InboundMessageTask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface InboundMessageTaskRepository extends JpaRepository<InboundMessageTask, Long> {

    boolean existsByProviderMessageId(String providerMessageId);

    /** Queue order for one contact: oldest message first */
    @Query("SELECT t FROM InboundMessageTask t " +
            "WHERE t.organizationId = :orgId AND t.contactPhone = :contact AND t.status = 'PENDING' " +
            "ORDER BY t.receivedAt, t.id")
    List<InboundMessageTask> findPendingForContact(@Param("orgId") Long organizationId,
                                                   @Param("contact") String contactPhone);

    @Query("SELECT t FROM InboundMessageTask t " +
            "WHERE t.status = 'FAILED' AND t.retryCount < :maxRetries ORDER BY t.receivedAt")
    List<InboundMessageTask> findRetryableFailures(@Param("maxRetries") int maxRetries);

    @Query("SELECT t FROM InboundMessageTask t " +
            "WHERE t.status = 'PROCESSING' AND t.startedAt < :stuckThreshold")
    List<InboundMessageTask> findStuckTasks(@Param("stuckThreshold") LocalDateTime stuckThreshold);

    @Query("SELECT t FROM InboundMessageTask t " +
            "WHERE t.status = 'PENDING' AND t.createdAt < :threshold ORDER BY t.receivedAt")
    List<InboundMessageTask> findOrphanedPending(@Param("threshold") LocalDateTime threshold);

    /** Claim: PENDING → PROCESSING. Exactly one worker gets 1. */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE InboundMessageTask t " +
            "SET t.status = 'PROCESSING', t.startedAt = :now " +
            "WHERE t.id = :taskId AND t.status = 'PENDING'")
    int claimTaskForProcessing(@Param("taskId") Long taskId, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE InboundMessageTask t " +
            "SET t.status = 'COMPLETED', t.finishedAt = :now, t.errorMessage = NULL " +
            "WHERE t.id = :taskId AND t.status = 'PROCESSING'")
    int completeTask(@Param("taskId") Long taskId, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE InboundMessageTask t " +
            "SET t.status = 'FAILED', t.errorMessage = :error, t.finishedAt = :now, " +
            "    t.retryCount = t.retryCount + 1 " +
            "WHERE t.id = :taskId AND t.status = 'PROCESSING'")
    int failTask(@Param("taskId") Long taskId,
                 @Param("error") String error,
                 @Param("now") LocalDateTime now);

    /** FAILED with the retry budget used up: the retry job never picks it again. */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE InboundMessageTask t " +
            "SET t.status = 'FAILED', t.errorMessage = :error, t.finishedAt = :now, " +
            "    t.retryCount = :maxRetries " +
            "WHERE t.id = :taskId AND t.status = 'PROCESSING'")
    int failTaskPermanently(@Param("taskId") Long taskId,
                            @Param("error") String error,
                            @Param("now") LocalDateTime now,
                            @Param("maxRetries") int maxRetries);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE InboundMessageTask t " +
            "SET t.status = 'PENDING', t.startedAt = NULL " +
            "WHERE t.id = :taskId AND t.status = 'PROCESSING'")
    int resetStuckTask(@Param("taskId") Long taskId);

    /** Retry claim: FAILED → PENDING. Atomic, prevents duplicate retries. */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE InboundMessageTask t " +
            "SET t.status = 'PENDING', t.startedAt = NULL " +
            "WHERE t.id = :taskId AND t.status = 'FAILED' AND t.retryCount < :maxRetries")
    int claimTaskForRetry(@Param("taskId") Long taskId, @Param("maxRetries") int maxRetries);
}
