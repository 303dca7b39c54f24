package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.config.ConversationProperties;
import com.aigreentick.services.conversations.constants.NodeType;
import com.aigreentick.services.conversations.entity.ConversationEvent.EventType;
import com.aigreentick.services.conversations.entity.ConversationState;
import com.aigreentick.services.conversations.entity.Flow;
import com.aigreentick.services.conversations.exception.FlowCycleDetectedException;
import com.aigreentick.services.conversations.exception.FlowNotFoundException;
import com.aigreentick.services.conversations.flow.FlowDefinitionLoader;
import com.aigreentick.services.conversations.flow.FlowGraph;
import com.aigreentick.services.conversations.flow.NextStep;
import com.aigreentick.services.conversations.flow.NextStepCodec;
import com.aigreentick.services.conversations.flow.NodeDefinition;
import com.aigreentick.services.conversations.flow.NodeExecution;
import com.aigreentick.services.conversations.flow.NodeExecutor;
import com.aigreentick.services.conversations.flow.OutboundReply;
import com.aigreentick.services.conversations.flow.TurnResult;
import com.aigreentick.services.conversations.flow.config.JumpNodeConfig;
import com.aigreentick.services.conversations.flow.config.QuestionNodeConfig;
import com.aigreentick.services.conversations.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives a conversation through its flow for one inbound message.
 *
 * A turn starts at the node the conversation is parked on (or the entry node
 * of a newly selected flow) and follows CONTINUE steps until a node waits for
 * input or the conversation terminates. Jumps move the conversation into
 * another flow within the same turn.
 *
 * The inbound text is consumed only by the first node executed when resuming
 * a parked conversation. A freshly started conversation treats the message as
 * its trigger and does not feed it to the entry node.
 *
 * State is written once, at the end of the turn. Any exception rolls the
 * whole turn back and leaves the stored state as it was. Every row the turn
 * wrote carries the id of the inbound message, so a replayed message can be
 * recognised as already applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlowRouter {

    private final ConversationStateService stateService;
    private final FlowDefinitionLoader flowLoader;
    private final NodeExecutor nodeExecutor;
    private final FlowRepository flowRepository;
    private final ConversationEventSink eventSink;
    private final ConversationProperties properties;

    /**
     * @param flowId    flow to start when the contact has no active conversation;
     *                  null selects by keyword, then the organization's main flow
     * @param userInput message text, may be null for non-text messages
     */
    @Transactional
    public TurnResult route(Long organizationId, String contactPhone, Long flowId, String userInput) {
        return route(organizationId, contactPhone, flowId, userInput, null);
    }

    /**
     * @param providerMessageId id of the inbound message driving the turn, stamped on the written state
     */
    @Transactional
    public TurnResult route(Long organizationId, String contactPhone, Long flowId, String userInput,
                            String providerMessageId) {
        ConversationState state;
        FlowGraph graph;
        String pendingInput;

        Optional<ConversationState> existing = flowId != null
                ? stateService.find(organizationId, contactPhone, flowId).filter(ConversationState::isActive)
                : stateService.findActive(organizationId, contactPhone);

        if (existing.isPresent()) {
            state = existing.get();
            graph = flowLoader.load(organizationId, state.getFlowId());
            pendingInput = userInput;
            if (!graph.contains(state.getCurrentNodeId())) {
                log.warn("State of contact {} points to missing node {} in flow {}, restarting at entry",
                        contactPhone, state.getCurrentNodeId(), graph.getFlowId());
                state.setCurrentNodeId(graph.getEntryNodeId());
                state.setQuestionAttempts(0);
                pendingInput = null;
            }
        } else {
            Flow flow = selectFlow(organizationId, flowId, userInput);
            graph = flowLoader.load(organizationId, flow.getId());
            state = stateService.activate(organizationId, contactPhone, graph.getFlowId(),
                    graph.getEntryNodeId(), new LinkedHashMap<>());
            pendingInput = null;
            log.info("Conversation started: org={}, contact={}, flow={}", organizationId, contactPhone, flow.getId());
        }

        Set<ConversationState> touched = new LinkedHashSet<>();
        touched.add(state);

        List<OutboundReply> replies = new ArrayList<>();
        Map<String, Object> variables = new LinkedHashMap<>(state.getVariables());
        String nodeId = state.getCurrentNodeId();
        int maxHops = properties.getMaxHopsPerMessage();
        int hops = 0;
        boolean terminated = false;

        while (true) {
            if (++hops > maxHops) {
                throw new FlowCycleDetectedException(graph.getFlowId(), nodeId, maxHops);
            }

            NodeDefinition node = graph.node(nodeId);
            boolean consumedInput = pendingInput != null;
            NodeExecution execution = nodeExecutor.execute(node, pendingInput, variables);
            pendingInput = null;
            variables = execution.getVariables();
            if (execution.getReply() != null) {
                replies.add(execution.getReply());
            }

            NextStep next = execution.getNext();
            if (execution.isValidationFailed()) {
                next = afterInvalidAnswer(state, graph, node);
            } else if (node.getType() == NodeType.QUESTION && consumedInput) {
                state.setQuestionAttempts(0);
            }

            if (next.isContinue()) {
                nodeId = next.getNodeId();
                continue;
            }
            if (next.isAwaitingInput()) {
                break;
            }
            if (next.isTerminate()) {
                terminated = true;
                eventSink.record(EventType.FLOW_TERMINATED, organizationId, contactPhone,
                        graph.getFlowId(), nodeId, null);
                break;
            }

            // jump: park the source flow and continue at the target's entry node
            boolean carry = node.getType() != NodeType.JUMP
                    || node.configAs(JumpNodeConfig.class).isCarryVariables();
            Long sourceFlowId = graph.getFlowId();
            variables = carry ? new LinkedHashMap<>(variables) : new LinkedHashMap<>();
            if (sourceFlowId.equals(next.getTargetFlowId())) {
                // restart of the current flow keeps its row
                state.setQuestionAttempts(0);
            } else {
                state.setCurrentNodeId(nodeId);
                state.setVariables(execution.getVariables());
                state.setActive(false);
                graph = flowLoader.load(organizationId, next.getTargetFlowId());
                state = stateService.activate(organizationId, contactPhone, graph.getFlowId(),
                        graph.getEntryNodeId(), variables);
                touched.add(state);
            }
            nodeId = graph.getEntryNodeId();

            eventSink.record(EventType.FLOW_JUMPED, organizationId, contactPhone, sourceFlowId, node.getNodeId(),
                    "to flow " + graph.getFlowId());
            log.debug("Jump: org={}, contact={}, {} -> {}", organizationId, contactPhone, sourceFlowId, graph.getFlowId());
        }

        state.setCurrentNodeId(nodeId);
        state.setVariables(variables);
        state.setActive(!terminated);
        for (ConversationState changed : touched) {
            changed.setLastProviderMessageId(providerMessageId);
            stateService.save(changed);
        }

        log.debug("Turn done: org={}, contact={}, flow={}, node={}, hops={}, replies={}, terminated={}",
                organizationId, contactPhone, graph.getFlowId(), nodeId, hops, replies.size(), terminated);

        return TurnResult.builder()
                .flowId(graph.getFlowId())
                .currentNodeId(nodeId)
                .replies(replies)
                .variables(variables)
                .terminated(terminated)
                .hops(hops)
                .build();
    }

    /**
     * Counts a rejected answer. Below the ceiling the question is asked again;
     * at the ceiling the conversation takes the fallback branch, or ends.
     */
    private NextStep afterInvalidAnswer(ConversationState state, FlowGraph graph, NodeDefinition node) {
        QuestionNodeConfig question = node.configAs(QuestionNodeConfig.class);
        int limit = question.getMaxAttempts() != null
                ? question.getMaxAttempts()
                : properties.getQuestionMaxAttempts();
        int attempts = state.getQuestionAttempts() + 1;

        if (attempts < limit) {
            state.setQuestionAttempts(attempts);
            return NextStep.awaitingInput();
        }

        state.setQuestionAttempts(0);
        eventSink.record(EventType.QUESTION_FALLBACK, state.getOrganizationId(), state.getContactPhone(),
                graph.getFlowId(), node.getNodeId(), attempts + " invalid answers");

        NextStep fallback = NextStepCodec.decode(question.getFallbackNodeId());
        if (fallback != null) {
            log.info("Question {} gave up after {} attempts, taking fallback {}",
                    node.getNodeId(), attempts, question.getFallbackNodeId());
            return fallback;
        }
        log.info("Question {} gave up after {} attempts, ending conversation", node.getNodeId(), attempts);
        return NextStep.terminate();
    }

    private Flow selectFlow(Long organizationId, Long flowId, String userInput) {
        if (flowId != null) {
            return flowRepository.findByIdAndOrganizationId(flowId, organizationId)
                    .filter(Flow::isActive)
                    .orElseThrow(() -> FlowNotFoundException.withId(flowId));
        }
        if (userInput != null && !userInput.isBlank()) {
            String keyword = userInput.trim();
            Optional<Flow> triggered = flowRepository.findKeywordFlows(organizationId).stream()
                    .filter(flow -> flow.getTriggerKeyword().trim().equalsIgnoreCase(keyword))
                    .findFirst();
            if (triggered.isPresent()) {
                log.debug("Keyword '{}' triggers flow {}", keyword, triggered.get().getId());
                return triggered.get();
            }
        }
        return flowRepository.findFirstByOrganizationIdAndMainTrueAndActiveTrue(organizationId)
                .orElseThrow(() -> FlowNotFoundException.noMainFlow(organizationId));
    }
}
