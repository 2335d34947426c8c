package org.carball.scholarflow.model.schema;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Type tag of a schema entry. Each constant knows how to check a submitted value against its
 * {@link FieldConstraints}, so form rendering and submission share one definition.
 */
@Getter
public enum FieldType {

    TEXT("text") {
        @Override
        public Optional<String> check(String value, FieldConstraints constraints) {
            return checkLength(value, constraints);
        }
    },

    TEXTAREA("textarea") {
        @Override
        public Optional<String> check(String value, FieldConstraints constraints) {
            return checkLength(value, constraints);
        }
    },

    NUMBER("number") {
        @Override
        public Optional<String> check(String value, FieldConstraints constraints) {
            BigDecimal number;
            try {
                number = new BigDecimal(value.trim());
            } catch (NumberFormatException e) {
                return Optional.of("'" + value + "' is not a number");
            }
            if (constraints.getMinValue() != null && number.compareTo(constraints.getMinValue()) < 0) {
                return Optional.of("must be at least " + constraints.getMinValue().toPlainString());
            }
            if (constraints.getMaxValue() != null && number.compareTo(constraints.getMaxValue()) > 0) {
                return Optional.of("must be at most " + constraints.getMaxValue().toPlainString());
            }
            return Optional.empty();
        }
    },

    SELECT("select") {
        @Override
        public Optional<String> check(String value, FieldConstraints constraints) {
            if (!constraints.getOptions().isEmpty() && !constraints.getOptions().contains(value)) {
                return Optional.of("'" + value + "' is not one of " + constraints.getOptions());
            }
            return Optional.empty();
        }
    },

    DATE("date") {
        @Override
        public Optional<String> check(String value, FieldConstraints constraints) {
            try {
                LocalDate.parse(value.trim());
                return Optional.empty();
            } catch (DateTimeParseException e) {
                return Optional.of("'" + value + "' is not an ISO date (yyyy-MM-dd)");
            }
        }
    },

    CHECKBOX("checkbox") {
        @Override
        public Optional<String> check(String value, FieldConstraints constraints) {
            if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                return Optional.of("must be true or false");
            }
            return Optional.empty();
        }

        @Override
        public boolean isFilled(String value) {
            return "true".equalsIgnoreCase(value);
        }
    },

    FILE_SET("file_set") {
        @Override
        public Optional<String> check(String value, FieldConstraints constraints) {
            return Optional.of("file sets are attached as documents, not entered as values");
        }
    };

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    /**
     * Returns a violation message, or empty when the value is acceptable.
     */
    public abstract Optional<String> check(String value, FieldConstraints constraints);

    /**
     * Whether a value satisfies a required field. An unticked checkbox does not.
     */
    public boolean isFilled(String value) {
        return value != null && !value.isBlank();
    }

    public static FieldType fromValue(String value) {
        for (FieldType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + value);
    }

    private static Optional<String> checkLength(String value, FieldConstraints constraints) {
        if (constraints.getMaxLength() != null && value.length() > constraints.getMaxLength()) {
            return Optional.of("exceeds maximum length " + constraints.getMaxLength());
        }
        return Optional.empty();
    }
}
