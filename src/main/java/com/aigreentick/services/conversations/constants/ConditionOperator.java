package com.aigreentick.services.conversations.constants;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Operators supported by condition nodes.
 * Each operator accepts its symbol and the long name used by older flow exports.
 */
public enum ConditionOperator {
    EQUALS("==", "equals", "eq"),
    NOT_EQUALS("!=", "not_equals", "ne"),
    GREATER(">", "greater_than", "gt"),
    LESS("<", "less_than", "lt"),
    GREATER_OR_EQUAL(">=", "greater_than_or_equal", "gte"),
    LESS_OR_EQUAL("<=", "less_than_or_equal", "lte"),
    IN("in", "in_list"),
    NOT_IN("not_in", "not_in_list"),
    CONTAINS("contains"),
    STARTS_WITH("starts_with");

    private final String symbol;
    private final List<String> aliases;

    ConditionOperator(String symbol, String... aliases) {
        this.symbol = symbol;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    @JsonCreator
    public static ConditionOperator fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Condition operator is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConditionOperator op : values()) {
            if (op.symbol.equals(normalized) || op.aliases.contains(normalized)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unsupported condition operator: " + value);
    }
}
