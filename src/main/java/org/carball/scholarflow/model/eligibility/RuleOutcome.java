package org.carball.scholarflow.model.eligibility;

public enum RuleOutcome {
    PASSED,
    /**
     * A hard rule the applicant failed but is exempted from through an active whitelist entry.
     */
    PASSED_BY_EXEMPTION,
    WARNING,
    FAILED,
    /**
     * A hard failure for which the applicant once held an exemption that has since been revoked.
     */
    FAILED_EXEMPTION_REVOKED
}
