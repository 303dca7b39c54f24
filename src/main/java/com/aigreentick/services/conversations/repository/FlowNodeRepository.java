package com.aigreentick.services.conversations.repository;

import com.aigreentick.services.conversations.entity.FlowNode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FlowNodeRepository extends JpaRepository<FlowNode, Long> {

    List<FlowNode> findByFlowId(Long flowId);
}
