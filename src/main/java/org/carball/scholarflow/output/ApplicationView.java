package org.carball.scholarflow.output;

import lombok.Builder;
import lombok.Value;
import org.carball.scholarflow.model.application.DocumentReference;
import org.carball.scholarflow.model.application.Intent;
import org.carball.scholarflow.model.application.ReviewDecision;
import org.carball.scholarflow.model.application.ReviewStage;
import org.carball.scholarflow.model.application.StatusChange;
import org.carball.scholarflow.model.eligibility.EligibilityReport;
import org.carball.scholarflow.model.eligibility.RuleResult;
import org.carball.scholarflow.workflow.ReviewAggregator.AggregateVerdict;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical read model of an application. Every role receives this shape; what differs per role is
 * which decisions and reviewer identities are filled in.
 */
@Value
@Builder
public class ApplicationView {
    String applicationId;
    String studentId;
    String scholarshipTypeCode;
    String subScholarshipCode;
    String status;
    String statusLabelZh;
    String statusLabelEn;
    boolean editable;
    boolean terminal;
    long version;
    int reviewCycle;
    Map<String, String> fieldValues;
    List<DocumentReference> documents;
    Set<String> advisorIds;
    List<StatusChange> history;
    List<ReviewDecision> decisions;
    Map<ReviewStage, AggregateVerdict> stageVerdicts;
    EligibilityReport eligibility;
    List<RuleResult> warnings;
    Set<Intent> permittedIntents;
    Instant createdAt;
    Instant submittedAt;
}
