package org.carball.scholarflow.model.eligibility;

import java.util.List;
import java.util.stream.Collectors;

public record EligibilityReport(
        List<RuleResult> passed,
        List<RuleResult> warnings,
        List<RuleResult> failed
) {
    public EligibilityReport {
        passed = List.copyOf(passed);
        warnings = List.copyOf(warnings);
        failed = List.copyOf(failed);
    }

    public static EligibilityReport empty() {
        return new EligibilityReport(List.of(), List.of(), List.of());
    }

    public boolean isEligible() {
        return failed.isEmpty();
    }

    public List<RuleResult> exempted() {
        return passed.stream()
                .filter(r -> r.outcome() == RuleOutcome.PASSED_BY_EXEMPTION)
                .collect(Collectors.toList());
    }
}
