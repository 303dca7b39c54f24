package com.aigreentick.services.conversations.repository;

import com.aigreentick.services.conversations.entity.ConversationEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationEventRepository extends JpaRepository<ConversationEvent, Long> {
}
