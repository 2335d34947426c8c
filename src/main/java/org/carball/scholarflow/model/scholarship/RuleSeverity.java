package org.carball.scholarflow.model.scholarship;

import lombok.Getter;

@Getter
public enum RuleSeverity {
    /**
     * Failure blocks submission unless the student holds an active exemption for the rule.
     */
    HARD("hard"),

    /**
     * Failure is surfaced to the applicant but never blocks submission.
     */
    WARNING("warning");

    private final String value;

    RuleSeverity(String value) {
        this.value = value;
    }

    public static RuleSeverity fromValue(String value) {
        for (RuleSeverity severity : values()) {
            if (severity.value.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown rule severity: " + value);
    }
}
