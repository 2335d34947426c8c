package org.carball.scholarflow.model.scholarship;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Comparison operators supported by eligibility rules. Expected values are validated when a rule
 * is defined, so {@link #test} can assume well-formed thresholds.
 */
@Getter
public enum RuleOperator {

    GREATER_OR_EQUAL(">=", true) {
        @Override
        public boolean test(Object actual, String expected) {
            return toDecimal(actual).compareTo(new BigDecimal(expected.trim())) >= 0;
        }
    },

    LESS_OR_EQUAL("<=", true) {
        @Override
        public boolean test(Object actual, String expected) {
            return toDecimal(actual).compareTo(new BigDecimal(expected.trim())) <= 0;
        }
    },

    EQUALS("==", false) {
        @Override
        public boolean test(Object actual, String expected) {
            return sameValue(actual, expected);
        }
    },

    NOT_EQUALS("!=", false) {
        @Override
        public boolean test(Object actual, String expected) {
            return !sameValue(actual, expected);
        }
    },

    IN("in", false) {
        @Override
        public boolean test(Object actual, String expected) {
            return candidates(expected).stream().anyMatch(c -> sameValue(actual, c));
        }
    },

    NOT_IN("not_in", false) {
        @Override
        public boolean test(Object actual, String expected) {
            return candidates(expected).stream().noneMatch(c -> sameValue(actual, c));
        }
    };

    private final String symbol;
    private final boolean numericOnly;

    RuleOperator(String symbol, boolean numericOnly) {
        this.symbol = symbol;
        this.numericOnly = numericOnly;
    }

    public abstract boolean test(Object actual, String expected);

    /**
     * Checks that an expected value is usable with this operator against the given field.
     * Returns a description of the problem, or empty when the definition is sound.
     */
    public Optional<String> checkDefinition(ConditionField field, String expected) {
        if (expected == null || expected.isBlank()) {
            return Optional.of("expected value is required");
        }
        if (numericOnly && !field.isNumeric()) {
            return Optional.of(String.format("operator '%s' requires a numeric field but '%s' is categorical",
                    symbol, field.getKey()));
        }
        if (field.isNumeric()) {
            List<String> values = (this == IN || this == NOT_IN) ? candidates(expected) : List.of(expected.trim());
            for (String value : values) {
                try {
                    new BigDecimal(value);
                } catch (NumberFormatException e) {
                    return Optional.of(String.format("'%s' is not a number for field '%s'", value, field.getKey()));
                }
            }
        }
        return Optional.empty();
    }

    public static RuleOperator fromSymbol(String symbol) {
        String normalized = symbol == null ? "" : symbol.trim();
        if ("notIn".equals(normalized)) {
            return NOT_IN;
        }
        for (RuleOperator operator : values()) {
            if (operator.symbol.equalsIgnoreCase(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown rule operator: " + symbol);
    }

    static List<String> candidates(String expected) {
        return Arrays.stream(expected.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static BigDecimal toDecimal(Object actual) {
        if (actual instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(actual.toString().trim());
    }

    private static boolean sameValue(Object actual, String candidate) {
        if (actual instanceof BigDecimal decimal) {
            try {
                return decimal.compareTo(new BigDecimal(candidate.trim())) == 0;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return actual.toString().equals(candidate.trim());
    }
}
