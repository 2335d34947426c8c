package org.carball.scholarflow.output;

import org.carball.scholarflow.catalog.ScholarshipCatalog;
import org.carball.scholarflow.model.application.Actor;
import org.carball.scholarflow.model.application.Application;
import org.carball.scholarflow.model.application.ReviewDecision;
import org.carball.scholarflow.model.application.ReviewStage;
import org.carball.scholarflow.model.application.Role;
import org.carball.scholarflow.model.application.StatusChange;
import org.carball.scholarflow.model.scholarship.ScholarshipType;
import org.carball.scholarflow.workflow.ReviewAggregator;
import org.carball.scholarflow.workflow.TransitionTable;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the role-specific projection of an {@link ApplicationView}.
 *
 * <ul>
 *   <li>students see their own application with reviewer identities removed</li>
 *   <li>professors see the recommendation stage only</li>
 *   <li>college reviewers and administrators see everything</li>
 * </ul>
 */
public class ApplicationViewProjector {

    private final ScholarshipCatalog catalog;
    private final ReviewAggregator aggregator;

    public ApplicationViewProjector(ScholarshipCatalog catalog, ReviewAggregator aggregator) {
        this.catalog = catalog;
        this.aggregator = aggregator;
    }

    public ApplicationView project(Application application, Actor viewer) {
        ScholarshipType type = catalog.require(application.getScholarshipTypeCode());

        return ApplicationView.builder()
                .applicationId(application.getId())
                .studentId(application.getStudentId())
                .scholarshipTypeCode(application.getScholarshipTypeCode())
                .subScholarshipCode(application.getSubScholarshipCode())
                .status(application.getStatus().getValue())
                .statusLabelZh(application.getStatus().getLabelZh())
                .statusLabelEn(application.getStatus().getLabelEn())
                .editable(application.getStatus().isEditable())
                .terminal(application.getStatus().isTerminal())
                .version(application.getVersion())
                .reviewCycle(application.getReviewCycle())
                .fieldValues(new LinkedHashMap<>(application.getFieldValues()))
                .documents(List.copyOf(application.getDocuments()))
                .advisorIds(new LinkedHashSet<>(application.getAdvisorIds()))
                .history(historyFor(application, viewer))
                .decisions(decisionsFor(application, viewer))
                .stageVerdicts(aggregator.aggregateRequired(application, type))
                .eligibility(application.getEligibilityAudit())
                .warnings(List.copyOf(application.getWarnings()))
                .permittedIntents(TransitionTable.permittedIntents(application, viewer))
                .createdAt(application.getCreatedAt())
                .submittedAt(application.getSubmittedAt())
                .build();
    }

    private static List<ReviewDecision> decisionsFor(Application application, Actor viewer) {
        return switch (viewer.role()) {
            case STUDENT -> application.getDecisions().stream()
                    .map(ReviewDecision::withoutReviewer)
                    .collect(Collectors.toList());
            case PROFESSOR -> application.getDecisions().stream()
                    .filter(d -> d.stage() == ReviewStage.PROFESSOR_RECOMMENDATION)
                    .collect(Collectors.toList());
            case COLLEGE, ADMIN, SUPER_ADMIN -> List.copyOf(application.getDecisions());
        };
    }

    private static List<StatusChange> historyFor(Application application, Actor viewer) {
        if (viewer.role() != Role.STUDENT) {
            return List.copyOf(application.getHistory());
        }
        return application.getHistory().stream()
                .map(change -> change.actorRole() == Role.STUDENT ? change
                        : new StatusChange(change.from(), change.to(), change.intent(), null, change.actorRole(), change.at()))
                .collect(Collectors.toList());
    }
}
