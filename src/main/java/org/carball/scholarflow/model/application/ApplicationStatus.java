package org.carball.scholarflow.model.application;

import lombok.Getter;

/**
 * Lifecycle states of a scholarship application:
 *
 * <pre>
 * DRAFT → SUBMITTED → UNDER_REVIEW → (PENDING_RECOMMENDATION → RECOMMENDED) → COLLEGE_REVIEW → APPROVED
 *                                                                                          ↘ REJECTED
 * DRAFT, SUBMITTED → WITHDRAWN
 * any review state → DRAFT (returned for revision)
 * </pre>
 *
 * <p>This enum is the single place status values are interpreted: display labels and the
 * editable / terminal predicates live here rather than at call sites.
 */
@Getter
public enum ApplicationStatus {
    DRAFT("draft", "草稿", "Draft"),
    SUBMITTED("submitted", "已提交", "Submitted"),
    UNDER_REVIEW("under_review", "審核中", "Under Review"),
    PENDING_RECOMMENDATION("pending_recommendation", "待教授推薦", "Pending Recommendation"),
    RECOMMENDED("recommended", "已推薦", "Recommended"),
    COLLEGE_REVIEW("college_review", "學院審核中", "College Review"),
    APPROVED("approved", "已核准", "Approved"),
    REJECTED("rejected", "已拒絕", "Rejected"),
    WITHDRAWN("withdrawn", "已撤回", "Withdrawn");

    private final String value;
    private final String labelZh;
    private final String labelEn;

    ApplicationStatus(String value, String labelZh, String labelEn) {
        this.value = value;
        this.labelZh = labelZh;
        this.labelEn = labelEn;
    }

    public boolean isEditable() {
        return this == DRAFT;
    }

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED || this == WITHDRAWN;
    }

    public boolean isInReview() {
        return this == UNDER_REVIEW || this == PENDING_RECOMMENDATION
                || this == RECOMMENDED || this == COLLEGE_REVIEW;
    }

    /**
     * Advisors may change only until the professor recommendation stage opens.
     */
    public boolean acceptsAdvisorChanges() {
        return this == DRAFT || this == SUBMITTED || this == UNDER_REVIEW;
    }

    /**
     * Counts toward the per-student active application limit.
     */
    public boolean isActive() {
        return !isTerminal();
    }

    public static ApplicationStatus fromValue(String value) {
        for (ApplicationStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown application status: " + value);
    }
}
