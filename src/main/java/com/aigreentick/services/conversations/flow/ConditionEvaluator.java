package com.aigreentick.services.conversations.flow;

import com.aigreentick.services.conversations.constants.ConditionOperator;
import com.aigreentick.services.conversations.flow.config.ConditionNodeConfig;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates condition nodes against conversation variables.
 *
 * Values are compared as numbers when both sides parse as numbers and as
 * strings otherwise. contains and starts_with ignore case. A variable that
 * was never set makes every operator evaluate to false.
 */
@Component
public class ConditionEvaluator {

    public boolean evaluate(ConditionNodeConfig condition, Map<String, Object> variables) {
        if (variables == null || !variables.containsKey(condition.getVariable())) {
            return false;
        }
        Object actual = variables.get(condition.getVariable());
        if (actual == null) {
            return false;
        }
        return evaluate(actual, condition.getOperator(), condition.getValue());
    }

    public boolean evaluate(Object actual, ConditionOperator operator, Object expected) {
        return switch (operator) {
            case EQUALS -> valuesEqual(actual, expected);
            case NOT_EQUALS -> !valuesEqual(actual, expected);
            case GREATER -> compare(actual, expected) > 0;
            case LESS -> compare(actual, expected) < 0;
            case GREATER_OR_EQUAL -> compare(actual, expected) >= 0;
            case LESS_OR_EQUAL -> compare(actual, expected) <= 0;
            case IN -> asList(expected).stream().anyMatch(candidate -> valuesEqual(actual, candidate));
            case NOT_IN -> asList(expected).stream().noneMatch(candidate -> valuesEqual(actual, candidate));
            case CONTAINS -> contains(actual, expected);
            case STARTS_WITH -> lower(actual).startsWith(lower(expected));
        };
    }

    private boolean valuesEqual(Object actual, Object expected) {
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    private int compare(Object actual, Object expected) {
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right);
        }
        return String.valueOf(actual).compareTo(String.valueOf(expected));
    }

    private boolean contains(Object actual, Object expected) {
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(element -> valuesEqual(element, expected));
        }
        return lower(actual).contains(lower(expected));
    }

    private List<Object> asList(Object expected) {
        if (expected instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (expected == null) {
            return List.of();
        }
        List<Object> items = new ArrayList<>();
        Arrays.stream(String.valueOf(expected).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(items::add);
        return items;
    }

    private static String lower(Object value) {
        return value == null ? "" : String.valueOf(value).toLowerCase(Locale.ROOT);
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
