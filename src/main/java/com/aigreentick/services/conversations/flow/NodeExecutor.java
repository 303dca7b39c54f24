package com.aigreentick.services.conversations.flow;

import com.aigreentick.services.conversations.constants.ConversationConstants;
import com.aigreentick.services.conversations.exception.ValidationFailedException;
import com.aigreentick.services.conversations.flow.config.ConditionNodeConfig;
import com.aigreentick.services.conversations.flow.config.EndNodeConfig;
import com.aigreentick.services.conversations.flow.config.JumpNodeConfig;
import com.aigreentick.services.conversations.flow.config.MessageNodeConfig;
import com.aigreentick.services.conversations.flow.config.QuestionNodeConfig;
import com.aigreentick.services.conversations.flow.config.StartNodeConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes a single node.
 *
 * Has no side effects: the incoming variables are never modified, the
 * returned execution carries a copy with any new answer applied.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NodeExecutor {

    private final InputValidator inputValidator;
    private final ConditionEvaluator conditionEvaluator;

    public NodeExecution execute(NodeDefinition node, String userInput, Map<String, Object> variables) {
        Map<String, Object> vars = variables != null ? new LinkedHashMap<>(variables) : new LinkedHashMap<>();

        return switch (node.getType()) {
            case START -> executeStart(node.configAs(StartNodeConfig.class), vars);
            case MESSAGE -> executeMessage(node.configAs(MessageNodeConfig.class), vars);
            case QUESTION -> executeQuestion(node, node.configAs(QuestionNodeConfig.class), userInput, vars);
            case CONDITION -> executeCondition(node, node.configAs(ConditionNodeConfig.class), vars);
            case JUMP -> NodeExecution.of(null,
                    NextStep.jumpTo(node.configAs(JumpNodeConfig.class).getTargetFlowId()), vars);
            case END -> executeEnd(node.configAs(EndNodeConfig.class), vars);
        };
    }

    private NodeExecution executeStart(StartNodeConfig config, Map<String, Object> vars) {
        OutboundReply reply = hasText(config.getText()) ? OutboundReply.plain(config.getText()) : null;
        NextStep next = NextStepCodec.decode(config.getNextNodeId());
        return NodeExecution.of(reply, next != null ? next : NextStep.awaitingInput(), vars);
    }

    private NodeExecution executeMessage(MessageNodeConfig config, Map<String, Object> vars) {
        OutboundReply reply = OutboundReply.withButtons(config.getText(), config.getButtons());
        NextStep next = NextStepCodec.decode(config.getNextNodeId());
        return NodeExecution.of(reply, next != null ? next : NextStep.terminate(), vars);
    }

    private NodeExecution executeQuestion(NodeDefinition node, QuestionNodeConfig config,
                                          String userInput, Map<String, Object> vars) {
        QuestionNodeConfig.Validation rule = config.effectiveValidation();

        if (userInput == null) {
            OutboundReply prompt = OutboundReply.withButtons(config.getText(), rule.getOptions());
            return NodeExecution.of(prompt, NextStep.awaitingInput(), vars);
        }

        try {
            Object value = inputValidator.validate(userInput, rule);
            vars.put(config.getVariable(), value);
        } catch (ValidationFailedException ex) {
            log.debug("Answer rejected at node {}: {}", node.getNodeId(), ex.getReason());
            String error = hasText(config.getErrorMessage())
                    ? config.getErrorMessage()
                    : ConversationConstants.DEFAULT_VALIDATION_ERROR;
            return NodeExecution.invalidAnswer(OutboundReply.plain(error), vars);
        }

        NextStep next = NextStepCodec.decode(config.getNextNodeId());
        return NodeExecution.of(null, next != null ? next : NextStep.terminate(), vars);
    }

    private NodeExecution executeCondition(NodeDefinition node, ConditionNodeConfig config, Map<String, Object> vars) {
        boolean result = conditionEvaluator.evaluate(config, vars);
        log.debug("Condition {} ({} {} {}) -> {}",
                node.getNodeId(), config.getVariable(), config.getOperator().getSymbol(), config.getValue(), result);
        String pointer = result ? config.getTrueNodeId() : config.getFalseNodeId();
        return NodeExecution.of(null, NextStepCodec.decode(pointer), vars);
    }

    private NodeExecution executeEnd(EndNodeConfig config, Map<String, Object> vars) {
        OutboundReply reply = hasText(config.getText()) ? OutboundReply.plain(config.getText()) : null;
        return NodeExecution.of(reply, NextStep.terminate(), vars);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
