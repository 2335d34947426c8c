package org.carball.scholarflow.exception;

import lombok.Getter;
import org.carball.scholarflow.model.eligibility.EligibilityReport;
import org.carball.scholarflow.model.eligibility.RuleResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more hard rules failed without an active exemption.
 */
@Getter
public class EligibilityException extends WorkflowException {

    private final String applicationId;
    private final EligibilityReport report;

    public EligibilityException(String applicationId, EligibilityReport report) {
        super("ELIGIBILITY_FAILED", String.format("Application %s failed %d eligibility rule(s): %s",
                applicationId, report.failed().size(),
                report.failed().stream().map(RuleResult::ruleName).collect(Collectors.joining(", "))));
        this.applicationId = applicationId;
        this.report = report;
    }

    public List<RuleResult> getFailedRules() {
        return report.failed();
    }
}
