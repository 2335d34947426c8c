package org.carball.scholarflow.workflow;

import org.carball.scholarflow.model.application.Application;
import org.carball.scholarflow.model.application.ReviewDecision;
import org.carball.scholarflow.model.application.ReviewStage;
import org.carball.scholarflow.model.application.Verdict;
import org.carball.scholarflow.model.scholarship.ScholarshipType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reduces the append-only decision list of one review stage to a single verdict.
 */
public class ReviewAggregator {

    public enum AggregateVerdict {
        PENDING,
        APPROVE,
        REJECT
    }

    /**
     * What a stage needs before it counts as approved.
     *
     * @param requiredApprovals   minimum number of distinct approving reviewers
     * @param requiredReviewerIds reviewers who must all have approved, possibly empty
     */
    public record StageRequirement(ReviewStage stage, int requiredApprovals, Set<String> requiredReviewerIds) {

        public StageRequirement {
            requiredReviewerIds = Set.copyOf(requiredReviewerIds);
        }
    }

    /**
     * Any rejection in the cycle rejects the stage. Otherwise only each reviewer's latest decision
     * counts toward approval.
     */
    public AggregateVerdict aggregate(List<ReviewDecision> decisions, int cycle, StageRequirement requirement) {
        List<ReviewDecision> relevant = decisions.stream()
                .filter(d -> d.stage() == requirement.stage() && d.cycle() == cycle)
                .collect(Collectors.toList());

        if (relevant.stream().anyMatch(d -> d.verdict() == Verdict.REJECT)) {
            return AggregateVerdict.REJECT;
        }

        Map<String, Verdict> latestByReviewer = new LinkedHashMap<>();
        for (ReviewDecision decision : relevant) {
            latestByReviewer.put(decision.reviewerId(), decision.verdict());
        }

        Set<String> approvers = latestByReviewer.entrySet().stream()
                .filter(e -> e.getValue() == Verdict.APPROVE)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());

        boolean namedApproved = approvers.containsAll(requirement.requiredReviewerIds());
        boolean enoughApprovals = approvers.size() >= Math.max(1, requirement.requiredApprovals());
        return namedApproved && enoughApprovals ? AggregateVerdict.APPROVE : AggregateVerdict.PENDING;
    }

    /**
     * Stages the scholarship type requires before a committee decision, in review order.
     */
    public List<StageRequirement> requirementsFor(Application application, ScholarshipType type) {
        List<StageRequirement> requirements = new ArrayList<>();
        if (type.isRequiresProfessorRecommendation()) {
            requirements.add(professorRequirement(application));
        }
        requirements.add(new StageRequirement(ReviewStage.COLLEGE_REVIEW, type.getCollegeApprovalsRequired(), Set.of()));
        return requirements;
    }

    public StageRequirement requirementFor(Application application, ScholarshipType type, ReviewStage stage) {
        return switch (stage) {
            case PROFESSOR_RECOMMENDATION -> professorRequirement(application);
            case COLLEGE_REVIEW -> new StageRequirement(stage, type.getCollegeApprovalsRequired(), Set.of());
            case COMMITTEE_DECISION -> new StageRequirement(stage, 1, Set.of());
        };
    }

    public Map<ReviewStage, AggregateVerdict> aggregateRequired(Application application, ScholarshipType type) {
        Map<ReviewStage, AggregateVerdict> verdicts = new EnumMap<>(ReviewStage.class);
        for (StageRequirement requirement : requirementsFor(application, type)) {
            verdicts.put(requirement.stage(),
                    aggregate(application.getDecisions(), application.getReviewCycle(), requirement));
        }
        return verdicts;
    }

    private static StageRequirement professorRequirement(Application application) {
        Set<String> advisors = application.getAdvisorIds();
        return new StageRequirement(ReviewStage.PROFESSOR_RECOMMENDATION, advisors.size(), advisors);
    }
}
