package org.carball.scholarflow.model.application;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.Setter;
import org.carball.scholarflow.model.eligibility.EligibilityReport;
import org.carball.scholarflow.model.eligibility.RuleResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate root of one scholarship application. The field values, document references and review
 * decisions belong to the application alone.
 */
@Data
@Builder(toBuilder = true)
public class Application {
    private String id;
    private String studentId;
    private String scholarshipTypeCode;
    private String subScholarshipCode;

    @Builder.Default
    private ApplicationStatus status = ApplicationStatus.DRAFT;

    private long version;

    private AcademicRecord academicRecord;

    @Builder.Default
    private Map<String, String> fieldValues = new LinkedHashMap<>();

    @Builder.Default
    private List<DocumentReference> documents = new ArrayList<>();

    @Builder.Default
    private Set<String> advisorIds = new LinkedHashSet<>();

    @Builder.Default
    private Map<ApplicationStatus, Instant> statusTimestamps = new EnumMap<>(ApplicationStatus.class);

    @Builder.Default
    @Setter(AccessLevel.NONE)
    private List<StatusChange> history = new ArrayList<>();

    @Builder.Default
    @Setter(AccessLevel.NONE)
    private List<ReviewDecision> decisions = new ArrayList<>();

    private int reviewCycle;

    private EligibilityReport eligibilityAudit;

    @Builder.Default
    private List<RuleResult> warnings = new ArrayList<>();

    private Instant createdAt;
    private Instant submittedAt;

    public List<ReviewDecision> getDecisions() {
        return Collections.unmodifiableList(decisions);
    }

    public List<StatusChange> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public void appendDecision(ReviewDecision decision) {
        decisions.add(decision);
    }

    public void appendStatusChange(StatusChange change) {
        history.add(change);
    }

    public boolean isOwnedBy(String actorId) {
        return studentId != null && studentId.equals(actorId);
    }

    public boolean hasAdvisor(String actorId) {
        return advisorIds.contains(actorId);
    }

    public int documentCount(String documentName) {
        return (int) documents.stream()
                .filter(d -> d.documentName().equals(documentName))
                .count();
    }

    /**
     * Copy with independent collections, used as the working state of a transition so a failed
     * guard leaves the stored aggregate untouched.
     */
    public Application copy() {
        return toBuilder()
                .academicRecord(academicRecord == null ? null : academicRecord.toBuilder().build())
                .fieldValues(new LinkedHashMap<>(fieldValues))
                .documents(new ArrayList<>(documents))
                .advisorIds(new LinkedHashSet<>(advisorIds))
                .statusTimestamps(statusTimestamps.isEmpty()
                        ? new EnumMap<>(ApplicationStatus.class) : new EnumMap<>(statusTimestamps))
                .history(new ArrayList<>(history))
                .decisions(new ArrayList<>(decisions))
                .warnings(new ArrayList<>(warnings))
                .build();
    }
}
