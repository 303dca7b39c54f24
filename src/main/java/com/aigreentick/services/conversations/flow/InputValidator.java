package com.aigreentick.services.conversations.flow;

import com.aigreentick.services.conversations.exception.ValidationFailedException;
import com.aigreentick.services.conversations.flow.config.QuestionNodeConfig.Validation;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates question answers and normalises them into the value stored as a variable.
 */
@Component
public class InputValidator {

    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[0-9\\s\\-()]{8,20}$");

    private static final int DEFAULT_MIN_LENGTH = 1;
    private static final int DEFAULT_MAX_LENGTH = 1000;

    /**
     * @return the value to store: trimmed text, a Long or BigDecimal for numbers,
     *         or the matching option label for choices
     * @throws ValidationFailedException when the answer is rejected
     */
    public Object validate(String input, Validation rule) {
        if (input == null || input.isBlank()) {
            throw new ValidationFailedException("empty answer");
        }
        String value = input.trim();
        Validation effective = rule != null ? rule : new Validation();

        return switch (effective.getKind()) {
            case TEXT -> validateText(value, effective);
            case EMAIL -> {
                if (!EMAIL.matcher(value).matches()) {
                    throw new ValidationFailedException("not an email address");
                }
                yield value;
            }
            case PHONE -> validatePhone(value);
            case NUMBER -> validateNumber(value, effective);
            case CHOICE -> validateChoice(value, effective.getOptions());
        };
    }

    public boolean isValid(String input, Validation rule) {
        try {
            validate(input, rule);
            return true;
        } catch (ValidationFailedException ex) {
            return false;
        }
    }

    private String validateText(String value, Validation rule) {
        int min = rule.getMinLength() != null ? rule.getMinLength() : DEFAULT_MIN_LENGTH;
        int max = rule.getMaxLength() != null ? rule.getMaxLength() : DEFAULT_MAX_LENGTH;
        if (value.length() < min) {
            throw new ValidationFailedException("shorter than " + min + " characters");
        }
        if (value.length() > max) {
            throw new ValidationFailedException("longer than " + max + " characters");
        }
        return value;
    }

    private String validatePhone(String value) {
        if (!PHONE.matcher(value).matches()) {
            throw new ValidationFailedException("not a phone number");
        }
        long digits = value.chars().filter(Character::isDigit).count();
        if (digits < 7) {
            throw new ValidationFailedException("too few digits for a phone number");
        }
        return value;
    }

    private Object validateNumber(String value, Validation rule) {
        BigDecimal number;
        try {
            number = new BigDecimal(value.replace(',', '.'));
        } catch (NumberFormatException ex) {
            throw new ValidationFailedException("not a number");
        }
        if (rule.getMin() != null && number.compareTo(rule.getMin()) < 0) {
            throw new ValidationFailedException("below minimum " + rule.getMin().toPlainString());
        }
        if (rule.getMax() != null && number.compareTo(rule.getMax()) > 0) {
            throw new ValidationFailedException("above maximum " + rule.getMax().toPlainString());
        }
        BigDecimal stripped = number.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                return stripped.longValueExact();
            } catch (ArithmeticException ignored) {
                return number;
            }
        }
        return number;
    }

    private String validateChoice(String value, List<String> options) {
        if (options == null || options.isEmpty()) {
            throw new ValidationFailedException("no options configured");
        }
        for (String option : options) {
            if (option.equalsIgnoreCase(value)) {
                return option;
            }
        }
        // contacts often answer with the option's position
        try {
            int index = Integer.parseInt(value);
            if (index >= 1 && index <= options.size()) {
                return options.get(index - 1);
            }
        } catch (NumberFormatException ignored) {
            // not a position either
        }
        throw new ValidationFailedException("'" + value.toLowerCase(Locale.ROOT) + "' is not one of the options");
    }
}
