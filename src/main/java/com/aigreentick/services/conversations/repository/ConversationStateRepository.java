package com.aigreentick.services.conversations.repository;

import com.aigreentick.services.conversations.entity.ConversationState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationStateRepository extends JpaRepository<ConversationState, Long> {

    Optional<ConversationState> findByOrganizationIdAndContactPhoneAndFlowId(
            Long organizationId, String contactPhone, Long flowId);

    boolean existsByOrganizationIdAndContactPhoneAndLastProviderMessageId(
            Long organizationId, String contactPhone, String lastProviderMessageId);

    @Query("SELECT s FROM ConversationState s " +
            "WHERE s.organizationId = :orgId AND s.contactPhone = :contact AND s.active = true " +
            "ORDER BY s.updatedAt DESC")
    List<ConversationState> findActiveForContact(@Param("orgId") Long organizationId,
                                                 @Param("contact") String contactPhone);

    /** Stale-session cleanup: conditional update, safe to run from several workers. */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ConversationState s " +
            "SET s.active = false, s.updatedAt = :now, s.version = s.version + 1 " +
            "WHERE s.active = true AND s.updatedAt < :threshold")
    int deactivateStale(@Param("threshold") LocalDateTime threshold,
                        @Param("now") LocalDateTime now);
}
