package org.carball.scholarflow.eligibility;

import lombok.extern.slf4j.Slf4j;
import org.carball.scholarflow.config.WorkflowSettings;
import org.carball.scholarflow.exception.ValidationException;
import org.carball.scholarflow.model.application.AcademicRecord;
import org.carball.scholarflow.model.eligibility.EligibilityReport;
import org.carball.scholarflow.model.eligibility.ExemptionSet;
import org.carball.scholarflow.model.eligibility.RuleOutcome;
import org.carball.scholarflow.model.eligibility.RuleResult;
import org.carball.scholarflow.model.scholarship.EligibilityRule;
import org.carball.scholarflow.model.scholarship.RuleSeverity;
import org.carball.scholarflow.model.scholarship.ScholarshipType;
import org.carball.scholarflow.model.scholarship.SubScholarship;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Evaluates eligibility rules against an applicant's academic record. Evaluation has no side
 * effects: identical input always yields an equal report.
 */
@Slf4j
public class EligibilityEvaluator {

    static final Comparator<EligibilityRule> RULE_ORDER = Comparator
            .comparingInt(EligibilityRule::getPriority)
            .thenComparing(EligibilityRule::getId, Comparator.nullsLast(Comparator.<Long>naturalOrder()))
            .thenComparing(EligibilityRule::getName, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final WorkflowSettings settings;

    public EligibilityEvaluator(WorkflowSettings settings) {
        this.settings = settings;
    }

    public EligibilityReport evaluate(AcademicRecord record, List<EligibilityRule> rules, ExemptionSet exemptions) {
        validateRecord(record);

        List<EligibilityRule> ordered = rules.stream()
                .filter(EligibilityRule::isActive)
                .sorted(RULE_ORDER)
                .collect(Collectors.toList());

        List<RuleResult> passed = new ArrayList<>();
        List<RuleResult> warnings = new ArrayList<>();
        List<RuleResult> failed = new ArrayList<>();

        for (EligibilityRule rule : ordered) {
            Object actual = rule.getConditionField().resolve(record);
            boolean satisfied = actual != null && rule.getOperator().test(actual, rule.getExpectedValue());

            if (satisfied) {
                passed.add(toResult(rule, actual, RuleOutcome.PASSED, null, null));
            } else if (rule.getSeverity() == RuleSeverity.WARNING) {
                // exemptions only neutralize hard rules
                warnings.add(failureResult(rule, actual, RuleOutcome.WARNING));
            } else if (exemptions.exempts(rule.getId())) {
                passed.add(failureResult(rule, actual, RuleOutcome.PASSED_BY_EXEMPTION));
            } else if (exemptions.wasRevoked(rule.getId())) {
                failed.add(failureResult(rule, actual, RuleOutcome.FAILED_EXEMPTION_REVOKED));
            } else {
                failed.add(failureResult(rule, actual, RuleOutcome.FAILED));
            }
        }

        log.debug("Evaluated {} rules: {} passed, {} warnings, {} failed",
                ordered.size(), passed.size(), warnings.size(), failed.size());
        return new EligibilityReport(passed, warnings, failed);
    }

    /**
     * Evaluates the rules that apply to an application of the given type and sub-scholarship.
     * This is the same path submission uses, so a preview never disagrees with the real check.
     */
    public EligibilityReport preview(AcademicRecord record, ScholarshipType type, String subCode, ExemptionSet exemptions) {
        return evaluate(record, type.rulesFor(subCode), exemptions);
    }

    /**
     * Sub-scholarships of a combined type the applicant currently qualifies for. A hard failure among
     * the common rules disqualifies every sub-scholarship.
     */
    public List<String> eligibleSubScholarships(AcademicRecord record, ScholarshipType type, ExemptionSet exemptions) {
        EligibilityReport common = evaluate(record, type.commonRules(), exemptions);
        if (!common.isEligible()) {
            return List.of();
        }

        List<String> eligible = new ArrayList<>();
        for (SubScholarship sub : type.getSubScholarships()) {
            EligibilityReport scoped = evaluate(record, type.rulesScopedTo(sub.getCode()), exemptions);
            if (scoped.isEligible()) {
                eligible.add(sub.getCode());
            }
        }
        return eligible;
    }

    /**
     * Rejects academic values outside their declared scale. These are input errors, distinct from
     * rule failures.
     */
    public void validateRecord(AcademicRecord record) {
        if (record == null) {
            throw new ValidationException("academic_record", "academic record is required");
        }

        Map<String, String> violations = new LinkedHashMap<>();
        checkRange(violations, "gpa", record.getGpa(), BigDecimal.ZERO, settings.getGpaScaleMax());
        checkRange(violations, "class_ranking_percent", record.getClassRankingPercent(),
                BigDecimal.ZERO, settings.getMaxRankingPercent());
        checkRange(violations, "dept_ranking_percent", record.getDeptRankingPercent(),
                BigDecimal.ZERO, settings.getMaxRankingPercent());
        if (record.getCompletedTerms() != null && record.getCompletedTerms() < 0) {
            violations.put("completed_terms", "must not be negative");
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private void checkRange(Map<String, String> violations, String field, BigDecimal value,
                            BigDecimal min, BigDecimal max) {
        if (value == null) {
            return;
        }
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            violations.put(field, String.format("%s is outside %s - %s",
                    value.toPlainString(), min.toPlainString(), max.toPlainString()));
        }
    }

    private RuleResult failureResult(EligibilityRule rule, Object actual, RuleOutcome outcome) {
        if (actual == null) {
            String missing = "Field " + rule.getConditionField().getKey() + " not found";
            return toResult(rule, null, outcome, missing, missing);
        }
        return toResult(rule, actual, outcome, rule.failureMessage(), rule.failureMessageEn());
    }

    private RuleResult toResult(EligibilityRule rule, Object actual, RuleOutcome outcome,
                                String message, String messageEn) {
        return new RuleResult(
                rule.getId(),
                rule.getName(),
                rule.getConditionField().getKey(),
                rule.getOperator().getSymbol(),
                rule.getExpectedValue(),
                actual == null ? null : render(actual),
                rule.getSeverity(),
                rule.getPriority(),
                rule.getSubScholarshipCode(),
                rule.getTag(),
                outcome,
                message,
                messageEn);
    }

    private String render(Object actual) {
        return actual instanceof BigDecimal decimal ? decimal.toPlainString() : actual.toString();
    }
}
