package com.aigreentick.services.conversations.repository;

import com.aigreentick.services.conversations.entity.Flow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FlowRepository extends JpaRepository<Flow, Long> {

    Optional<Flow> findByIdAndOrganizationId(Long id, Long organizationId);

    Optional<Flow> findFirstByOrganizationIdAndMainTrueAndActiveTrue(Long organizationId);

    @Query("SELECT f FROM Flow f " +
            "WHERE f.organizationId = :orgId AND f.active = true AND f.triggerKeyword IS NOT NULL")
    List<Flow> findKeywordFlows(@Param("orgId") Long organizationId);
}
