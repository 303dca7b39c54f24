package com.aigreentick.services.conversations.repository;

import com.aigreentick.services.conversations.entity.ConversationWindow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationWindowRepository extends JpaRepository<ConversationWindow, Long> {

    Optional<ConversationWindow> findByOrganizationIdAndContactPhone(Long organizationId, String contactPhone);

    @Query("SELECT DISTINCT w.organizationId FROM ConversationWindow w WHERE w.status <> 'EXPIRED'")
    List<Long> findOrganizationsWithOpenWindows();

    /**
     * Expiry sweep. A single conditional UPDATE: a row already EXPIRED is
     * never matched again, so concurrent or repeated sweeps count each
     * window exactly once.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ConversationWindow w " +
            "SET w.status = 'EXPIRED', w.active = false " +
            "WHERE w.organizationId = :orgId AND w.endsAt <= :now AND w.status <> 'EXPIRED'")
    int expireElapsed(@Param("orgId") Long organizationId, @Param("now") LocalDateTime now);
}
