package com.aigreentick.services.conversations.flow.config;

import com.aigreentick.services.conversations.constants.ValidationKind;
import com.aigreentick.services.conversations.exception.FlowDefinitionException;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Asks the contact something and stores the validated answer under {@code variable}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QuestionNodeConfig implements NodeConfig {

    private String text;

    @JsonAlias({"variable_name", "save_to"})
    private String variable;

    @Builder.Default
    private Validation validation = new Validation();

    /** Reply sent for an invalid answer; a generic message is used when absent */
    @JsonAlias("error_message")
    private String errorMessage;

    @JsonAlias({"next_node_id", "next"})
    private String nextNodeId;

    /** Overrides conversation.question-max-attempts for this node */
    @JsonAlias("max_attempts")
    private Integer maxAttempts;

    /** Taken once the attempts run out; without it the conversation ends */
    @JsonAlias("fallback_node_id")
    private String fallbackNodeId;

    @Override
    public List<String> pointers() {
        List<String> pointers = new ArrayList<>();
        if (nextNodeId != null) {
            pointers.add(nextNodeId);
        }
        if (fallbackNodeId != null) {
            pointers.add(fallbackNodeId);
        }
        return pointers;
    }

    @Override
    public void validate(String nodeId) {
        if (text == null || text.isBlank()) {
            throw new FlowDefinitionException("Question node " + nodeId + " has no text");
        }
        if (variable == null || variable.isBlank()) {
            throw new FlowDefinitionException("Question node " + nodeId + " has no target variable");
        }
        if (maxAttempts != null && maxAttempts < 1) {
            throw new FlowDefinitionException("Question node " + nodeId + " max attempts must be positive");
        }
        Validation rule = effectiveValidation();
        if (rule.getKind() == ValidationKind.CHOICE && (rule.getOptions() == null || rule.getOptions().isEmpty())) {
            throw new FlowDefinitionException("Question node " + nodeId + " uses choice validation without options");
        }
    }

    public Validation effectiveValidation() {
        return validation != null ? validation : new Validation();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Validation {

        @Builder.Default
        @JsonAlias("type")
        private ValidationKind kind = ValidationKind.TEXT;

        @JsonAlias("min_length")
        private Integer minLength;

        @JsonAlias("max_length")
        private Integer maxLength;

        private BigDecimal min;

        private BigDecimal max;

        @Builder.Default
        private List<String> options = new ArrayList<>();
    }
}
