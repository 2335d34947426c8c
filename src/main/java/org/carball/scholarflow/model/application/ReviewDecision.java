package org.carball.scholarflow.model.application;

import java.time.Instant;

/**
 * One reviewer decision. Decisions are only ever appended; the effective review state of a stage is
 * derived by reducing the decisions of the current review cycle.
 */
public record ReviewDecision(
        String applicationId,
        ReviewStage stage,
        String reviewerId,
        Role reviewerRole,
        Verdict verdict,
        String comment,
        Instant decidedAt,
        int cycle
) {
    public ReviewDecision withoutReviewer() {
        return new ReviewDecision(applicationId, stage, null, reviewerRole, verdict, comment, decidedAt, cycle);
    }
}
