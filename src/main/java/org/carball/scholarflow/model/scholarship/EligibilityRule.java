package org.carball.scholarflow.model.scholarship;

import lombok.Builder;
import lombok.Data;
import org.carball.scholarflow.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
public class EligibilityRule {
    private Long id;
    private String scholarshipTypeCode;
    private String subScholarshipCode;
    private String name;
    private ConditionField conditionField;
    private RuleOperator operator;
    private String expectedValue;
    private RuleSeverity severity;
    private int priority;

    @Builder.Default
    private boolean active = true;

    private String tag;
    private String messageZh;
    private String messageEn;

    public boolean isHard() {
        return severity == RuleSeverity.HARD;
    }

    public boolean appliesTo(String subCode) {
        return subScholarshipCode == null || subScholarshipCode.equals(subCode);
    }

    /**
     * Rejects incomplete or inconsistent rule definitions before they reach the evaluator.
     */
    public void validateDefinition() {
        Map<String, String> problems = new LinkedHashMap<>();
        if (name == null || name.isBlank()) {
            problems.put("name", "rule name is required");
        }
        if (scholarshipTypeCode == null || scholarshipTypeCode.isBlank()) {
            problems.put("scholarship_type", "scholarship type is required");
        }
        if (conditionField == null) {
            problems.put("field", "condition field is required");
        }
        if (operator == null) {
            problems.put("operator", "operator is required");
        }
        if (severity == null) {
            problems.put("severity", "severity is required");
        }
        if (conditionField != null && operator != null) {
            operator.checkDefinition(conditionField, expectedValue)
                    .ifPresent(problem -> problems.put("expected", problem));
        }
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
    }

    public String failureMessage() {
        return messageZh != null ? messageZh : "Failed validation for " + name;
    }

    public String failureMessageEn() {
        return messageEn != null ? messageEn : "Failed validation for " + name;
    }
}
