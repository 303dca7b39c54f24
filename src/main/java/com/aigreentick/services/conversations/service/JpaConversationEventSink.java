package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.entity.ConversationEvent;
import com.aigreentick.services.conversations.entity.ConversationEvent.EventType;
import com.aigreentick.services.conversations.repository.ConversationEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaConversationEventSink implements ConversationEventSink {

    private static final int MAX_DETAIL_LENGTH = 1000;

    private final ConversationEventRepository eventRepository;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(EventType type, Long organizationId, String contactPhone,
                       Long flowId, String nodeId, String detail) {
        ConversationEvent event = ConversationEvent.builder()
                .eventType(type)
                .organizationId(organizationId)
                .contactPhone(contactPhone)
                .flowId(flowId)
                .nodeId(nodeId)
                .detail(truncate(detail))
                .createdAt(LocalDateTime.now(clock))
                .build();
        eventRepository.save(event);
        log.debug("Event {} org={} contact={} flow={} node={}", type, organizationId, contactPhone, flowId, nodeId);
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_DETAIL_LENGTH) {
            return detail;
        }
        return detail.substring(0, MAX_DETAIL_LENGTH);
    }
}
