package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.config.ConversationProperties;
import com.aigreentick.services.conversations.constants.ValidationKind;
import com.aigreentick.services.conversations.entity.ConversationEvent.EventType;
import com.aigreentick.services.conversations.entity.ConversationState;
import com.aigreentick.services.conversations.entity.Flow;
import com.aigreentick.services.conversations.exception.FlowCycleDetectedException;
import com.aigreentick.services.conversations.exception.FlowNotFoundException;
import com.aigreentick.services.conversations.flow.ConditionEvaluator;
import com.aigreentick.services.conversations.flow.FlowDefinitionLoader;
import com.aigreentick.services.conversations.flow.FlowGraph;
import com.aigreentick.services.conversations.flow.InputValidator;
import com.aigreentick.services.conversations.flow.NodeExecutor;
import com.aigreentick.services.conversations.flow.TurnResult;
import com.aigreentick.services.conversations.flow.config.QuestionNodeConfig;
import com.aigreentick.services.conversations.repository.FlowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.aigreentick.services.conversations.flow.FlowFixtures.end;
import static com.aigreentick.services.conversations.flow.FlowFixtures.graph;
import static com.aigreentick.services.conversations.flow.FlowFixtures.jump;
import static com.aigreentick.services.conversations.flow.FlowFixtures.message;
import static com.aigreentick.services.conversations.flow.FlowFixtures.question;
import static com.aigreentick.services.conversations.flow.FlowFixtures.start;
import static com.aigreentick.services.conversations.flow.FlowFixtures.validation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FlowRouter Unit Tests")
class FlowRouterTest {

    private static final Long ORG = 10L;
    private static final String CONTACT = "919800000001";

    @Mock
    private ConversationStateService stateService;

    @Mock
    private FlowDefinitionLoader flowLoader;

    @Mock
    private FlowRepository flowRepository;

    @Mock
    private ConversationEventSink eventSink;

    private ConversationProperties properties;
    private FlowRouter router;

    @BeforeEach
    void setUp() {
        properties = new ConversationProperties();
        NodeExecutor executor = new NodeExecutor(new InputValidator(), new ConditionEvaluator());
        router = new FlowRouter(stateService, flowLoader, executor, flowRepository, eventSink, properties);

        lenient().when(stateService.save(any(ConversationState.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(stateService.activate(anyLong(), anyString(), anyLong(), anyString(), anyMap()))
                .thenAnswer(inv -> ConversationState.builder()
                        .organizationId(inv.getArgument(0))
                        .contactPhone(inv.getArgument(1))
                        .flowId(inv.getArgument(2))
                        .currentNodeId(inv.getArgument(3))
                        .variables(new LinkedHashMap<>(inv.<Map<String, Object>>getArgument(4)))
                        .build());
    }

    @Test
    @DisplayName("Onboarding flow runs from greeting to goodbye over two messages")
    void fullConversation() {
        // Given
        FlowGraph onboarding = graph(1L, ORG, "s",
                start("s", "Hi", "q"),
                question("q", "Name?", "name", "m"),
                message("m", "Nice to meet you", "e"),
                end("e", "Bye"));
        when(flowRepository.findKeywordFlows(ORG)).thenReturn(List.of());
        when(flowRepository.findFirstByOrganizationIdAndMainTrueAndActiveTrue(ORG)).thenReturn(Optional.of(mainFlow(1L)));
        when(flowLoader.load(ORG, 1L)).thenReturn(onboarding);
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.empty());

        // When: first message only triggers the flow
        TurnResult first = router.route(ORG, CONTACT, null, "hello");

        // Then
        assertThat(first.getResponses()).containsExactly("Hi", "Name?");
        assertThat(first.getCurrentNodeId()).isEqualTo("q");
        assertThat(first.isTerminated()).isFalse();
        assertThat(first.getHops()).isEqualTo(2);
        assertThat(first.getVariables()).doesNotContainKey("name");

        ArgumentCaptor<ConversationState> saved = ArgumentCaptor.forClass(ConversationState.class);
        verify(stateService).save(saved.capture());
        ConversationState state = saved.getValue();
        assertThat(state.getCurrentNodeId()).isEqualTo("q");
        assertThat(state.isActive()).isTrue();

        // When: the answer finishes the flow
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.of(state));
        TurnResult second = router.route(ORG, CONTACT, null, "Jane");

        // Then
        assertThat(second.getResponses()).containsExactly("Nice to meet you", "Bye");
        assertThat(second.isTerminated()).isTrue();
        assertThat(second.getVariables()).containsEntry("name", "Jane");
        assertThat(state.isActive()).isFalse();
        verify(eventSink).record(eq(EventType.FLOW_TERMINATED), eq(ORG), eq(CONTACT), eq(1L), eq("e"), isNull());
    }

    @Test
    @DisplayName("Saved state remembers the provider message it applied")
    void recordsAppliedMessage() {
        FlowGraph onboarding = graph(1L, ORG, "s",
                start("s", "Hi", "q"),
                question("q", "Name?", "name", "e"),
                end("e", "Bye"));
        when(flowRepository.findKeywordFlows(ORG)).thenReturn(List.of());
        when(flowRepository.findFirstByOrganizationIdAndMainTrueAndActiveTrue(ORG)).thenReturn(Optional.of(mainFlow(1L)));
        when(flowLoader.load(ORG, 1L)).thenReturn(onboarding);
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.empty());

        router.route(ORG, CONTACT, null, "hello", "wamid.in.9");

        ArgumentCaptor<ConversationState> saved = ArgumentCaptor.forClass(ConversationState.class);
        verify(stateService).save(saved.capture());
        assertThat(saved.getValue().getLastProviderMessageId()).isEqualTo("wamid.in.9");
    }

    @Test
    @DisplayName("Keyword match selects the keyword flow over the main flow")
    void keywordSelectsFlow() {
        Flow sales = Flow.builder().id(2L).organizationId(ORG).entryNodeId("s").triggerKeyword("SALES").build();
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.empty());
        when(flowRepository.findKeywordFlows(ORG)).thenReturn(List.of(sales));
        when(flowLoader.load(ORG, 2L)).thenReturn(graph(2L, ORG, "s",
                start("s", null, "q"),
                question("q", "Which product?", "product", null)));

        TurnResult result = router.route(ORG, CONTACT, null, " sales ");

        assertThat(result.getFlowId()).isEqualTo(2L);
        assertThat(result.getResponses()).containsExactly("Which product?");
        verify(flowRepository, never()).findFirstByOrganizationIdAndMainTrueAndActiveTrue(any());
    }

    @Test
    @DisplayName("No active conversation and no main flow fails with FlowNotFoundException")
    void noMainFlow() {
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.empty());
        when(flowRepository.findKeywordFlows(ORG)).thenReturn(List.of());
        when(flowRepository.findFirstByOrganizationIdAndMainTrueAndActiveTrue(ORG)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> router.route(ORG, CONTACT, null, "hi"))
                .isInstanceOf(FlowNotFoundException.class);
    }

    @Test
    @DisplayName("A loop of auto-advancing nodes is stopped at the hop limit and nothing is saved")
    void cycleIsDetected() {
        properties.setMaxHopsPerMessage(10);
        ConversationState state = activeState(1L, "m1");
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.of(state));
        when(flowLoader.load(ORG, 1L)).thenReturn(graph(1L, ORG, "m1",
                message("m1", "ping", "m2"),
                message("m2", "pong", "m1")));

        assertThatThrownBy(() -> router.route(ORG, CONTACT, null, "go"))
                .isInstanceOf(FlowCycleDetectedException.class);
        verify(stateService, never()).save(any());
    }

    @Test
    @DisplayName("Invalid answer below the ceiling re-asks and counts the attempt")
    void invalidAnswerIsCounted() {
        ConversationState state = activeState(1L, "q");
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.of(state));
        when(flowLoader.load(ORG, 1L)).thenReturn(graph(1L, ORG, "q", ageQuestion(3, "help"), help()));

        TurnResult result = router.route(ORG, CONTACT, null, "old enough");

        assertThat(result.getResponses()).containsExactly("Please send a number");
        assertThat(result.getCurrentNodeId()).isEqualTo("q");
        assertThat(state.getQuestionAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Reaching the attempt ceiling takes the fallback branch")
    void fallbackAfterCeiling() {
        ConversationState state = activeState(1L, "q");
        state.setQuestionAttempts(1);
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.of(state));
        when(flowLoader.load(ORG, 1L)).thenReturn(graph(1L, ORG, "q", ageQuestion(2, "help"), help()));

        TurnResult result = router.route(ORG, CONTACT, null, "old enough");

        assertThat(result.getResponses()).containsExactly("Please send a number", "An agent will contact you");
        assertThat(result.isTerminated()).isTrue();
        assertThat(state.getQuestionAttempts()).isZero();
        verify(eventSink).record(eq(EventType.QUESTION_FALLBACK), eq(ORG), eq(CONTACT), eq(1L), eq("q"), anyString());
    }

    @Test
    @DisplayName("Reaching the ceiling without a fallback ends the conversation")
    void ceilingWithoutFallbackTerminates() {
        ConversationState state = activeState(1L, "q");
        state.setQuestionAttempts(2);
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.of(state));
        when(flowLoader.load(ORG, 1L)).thenReturn(graph(1L, ORG, "q", ageQuestion(null, null)));

        TurnResult result = router.route(ORG, CONTACT, null, "old enough");

        assertThat(result.isTerminated()).isTrue();
        assertThat(state.isActive()).isFalse();
    }

    @Test
    @DisplayName("Jump parks the source flow and continues in the target flow in the same turn")
    void jumpCarriesVariables() {
        ConversationState source = activeState(1L, "q");
        source.getVariables().put("name", "Jane");
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.of(source));
        when(flowLoader.load(ORG, 1L)).thenReturn(graph(1L, ORG, "q",
                question("q", "Department?", "dept", "j"),
                jump("j", 2L, true)));
        when(flowLoader.load(ORG, 2L)).thenReturn(graph(2L, ORG, "s2",
                start("s2", "Sales here", "q2"),
                question("q2", "Budget?", "budget", null)));

        TurnResult result = router.route(ORG, CONTACT, null, "Sales");

        assertThat(result.getFlowId()).isEqualTo(2L);
        assertThat(result.getCurrentNodeId()).isEqualTo("q2");
        assertThat(result.getResponses()).containsExactly("Sales here", "Budget?");
        assertThat(result.getVariables()).containsEntry("name", "Jane").containsEntry("dept", "Sales");
        assertThat(source.isActive()).isFalse();

        verify(stateService).save(source);
        verify(eventSink).record(eq(EventType.FLOW_JUMPED), eq(ORG), eq(CONTACT), eq(1L), eq("j"), anyString());
    }

    @Test
    @DisplayName("Jump with carryVariables=false starts the target flow empty")
    void jumpWithoutCarry() {
        ConversationState source = activeState(1L, "q");
        source.getVariables().put("name", "Jane");
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.of(source));
        when(flowLoader.load(ORG, 1L)).thenReturn(graph(1L, ORG, "q",
                question("q", "Department?", "dept", "j"),
                jump("j", 2L, false)));
        when(flowLoader.load(ORG, 2L)).thenReturn(graph(2L, ORG, "q2",
                question("q2", "Budget?", "budget", null)));

        TurnResult result = router.route(ORG, CONTACT, null, "Sales");

        assertThat(result.getVariables()).isEmpty();
        assertThat(source.getVariables()).containsEntry("dept", "Sales");
    }

    @Test
    @DisplayName("State pointing at a deleted node restarts at the entry node without consuming input")
    void missingNodeRestarts() {
        ConversationState state = activeState(1L, "deleted");
        when(stateService.findActive(ORG, CONTACT)).thenReturn(Optional.of(state));
        when(flowLoader.load(ORG, 1L)).thenReturn(graph(1L, ORG, "s",
                start("s", "Hi again", "q"),
                question("q", "Name?", "name", null)));

        TurnResult result = router.route(ORG, CONTACT, null, "Jane");

        assertThat(result.getResponses()).containsExactly("Hi again", "Name?");
        assertThat(result.getVariables()).doesNotContainKey("name");
    }

    // ========================
    // helpers
    // ========================

    private static Flow mainFlow(Long id) {
        return Flow.builder().id(id).organizationId(ORG).entryNodeId("s").main(true).build();
    }

    private static ConversationState activeState(Long flowId, String nodeId) {
        return ConversationState.builder()
                .id(100L + flowId)
                .organizationId(ORG)
                .contactPhone(CONTACT)
                .flowId(flowId)
                .currentNodeId(nodeId)
                .variables(new LinkedHashMap<>())
                .build();
    }

    private static com.aigreentick.services.conversations.flow.NodeDefinition ageQuestion(Integer maxAttempts,
                                                                                          String fallback) {
        return question("q", QuestionNodeConfig.builder()
                .text("Age?")
                .variable("age")
                .validation(validation(ValidationKind.NUMBER))
                .errorMessage("Please send a number")
                .maxAttempts(maxAttempts)
                .fallbackNodeId(fallback)
                .build());
    }

    private static com.aigreentick.services.conversations.flow.NodeDefinition help() {
        return message("help", "An agent will contact you", null);
    }
}
