package org.carball.scholarflow.model.eligibility;

import org.carball.scholarflow.model.scholarship.RuleSeverity;

public record RuleResult(
        Long ruleId,
        String ruleName,
        String conditionField,
        String operator,
        String expectedValue,
        String actualValue,
        RuleSeverity severity,
        int priority,
        String subScholarshipCode,
        String tag,
        RuleOutcome outcome,
        String message,
        String messageEn
) {
}
