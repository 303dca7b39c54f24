package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.constants.ConversationConstants;
import com.aigreentick.services.conversations.dto.response.DispatchResult;
import com.aigreentick.services.conversations.entity.ConversationEvent.EventType;
import com.aigreentick.services.conversations.entity.InboundMessageTask;
import com.aigreentick.services.conversations.exception.ConversationServiceException;
import com.aigreentick.services.conversations.flow.OutboundReply;
import com.aigreentick.services.conversations.flow.TurnResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Runs one conversation turn for a queued contact message.
 *
 * The turn holds the contact's conversation lock from window reset to the
 * last reply, so replies to consecutive messages never interleave; message
 * order itself comes from {@link InboundMessageWorker}. Provider retries run
 * under the lock and delay only later messages of the same contact.
 *
 * The routed state is committed before replies go out, stamped with the
 * provider message id. A replayed task whose message already advanced the
 * conversation is skipped instead of being answered twice; replies that had
 * not gone out before the failure are not resent. A reply that cannot be
 * delivered is recorded and alerted but does not undo the turn.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboundMessageHandler {

    private static final String ALERT_TURN_FAILED = "TURN_FAILED";

    private final ConversationLockRegistry lockRegistry;
    private final ConversationWindowService windowService;
    private final ConversationStateService stateService;
    private final FlowRouter flowRouter;
    private final MessageDispatcher dispatcher;
    private final ConversationEventSink eventSink;
    private final AlertPublisher alertPublisher;

    public TurnResult handle(InboundMessageTask task) {
        Long organizationId = task.getOrganizationId();
        String contactPhone = task.getContactPhone();

        return lockRegistry.withLock(organizationId, contactPhone, () -> {
            if (stateService.isApplied(organizationId, contactPhone, task.getProviderMessageId())) {
                log.info("Message {} already applied for org={} contact={}, skipping replay",
                        task.getProviderMessageId(), organizationId, contactPhone);
                return TurnResult.builder().replies(List.of()).variables(Map.of()).build();
            }

            windowService.reset(organizationId, contactPhone);
            eventSink.record(EventType.MESSAGE_RECEIVED, organizationId, contactPhone, null, null,
                    task.getMessageType());

            TurnResult turn;
            try {
                turn = routeWithRetry(organizationId, contactPhone, task.getBody(), task.getProviderMessageId());
            } catch (ConversationServiceException ex) {
                eventSink.record(EventType.TURN_FAILED, organizationId, contactPhone, null, null,
                        ex.getErrorCode() + ": " + ex.getMessage());
                alertPublisher.publish(ALERT_TURN_FAILED, organizationId, contactPhone, ex.getMessage());
                throw ex;
            }

            int delivered = 0;
            for (OutboundReply reply : turn.getReplies()) {
                if (deliver(organizationId, contactPhone, turn, reply)) {
                    delivered++;
                }
            }

            eventSink.record(EventType.TURN_COMPLETED, organizationId, contactPhone, turn.getFlowId(),
                    turn.getCurrentNodeId(), delivered + "/" + turn.getReplies().size() + " replies delivered");
            return turn;
        });
    }

    private TurnResult routeWithRetry(Long organizationId, String contactPhone, String input,
                                      String providerMessageId) {
        for (int attempt = 1; ; attempt++) {
            try {
                return flowRouter.route(organizationId, contactPhone, null, input, providerMessageId);
            } catch (ObjectOptimisticLockingFailureException ex) {
                if (attempt >= ConversationConstants.MAX_TURN_ATTEMPTS) {
                    throw ex;
                }
                log.warn("Concurrent update of conversation org={} contact={}, retrying turn ({}/{})",
                        organizationId, contactPhone, attempt, ConversationConstants.MAX_TURN_ATTEMPTS);
            }
        }
    }

    private boolean deliver(Long organizationId, String contactPhone, TurnResult turn, OutboundReply reply) {
        try {
            DispatchResult result = dispatcher.sendReply(organizationId, contactPhone, reply);
            return result.isSuccess();
        } catch (ConversationServiceException ex) {
            // rate limit or closed window: the turn stands, the reply is lost
            log.warn("Reply not sent: org={}, contact={}, flow={}: {}",
                    organizationId, contactPhone, turn.getFlowId(), ex.getMessage());
            eventSink.record(EventType.DISPATCH_FAILED, organizationId, contactPhone, turn.getFlowId(),
                    turn.getCurrentNodeId(), ex.getErrorCode() + ": " + ex.getMessage());
            alertPublisher.publish(ex.getErrorCode(), organizationId, contactPhone, ex.getMessage());
            return false;
        }
    }
}
