package org.carball.scholarflow.workflow;

import lombok.extern.slf4j.Slf4j;
import org.carball.scholarflow.catalog.ScholarshipCatalog;
import org.carball.scholarflow.config.WorkflowSettings;
import org.carball.scholarflow.eligibility.EligibilityEvaluator;
import org.carball.scholarflow.exception.EligibilityException;
import org.carball.scholarflow.exception.IllegalTransitionException;
import org.carball.scholarflow.exception.IncompleteSubmissionException;
import org.carball.scholarflow.exception.PermissionException;
import org.carball.scholarflow.exception.ValidationException;
import org.carball.scholarflow.model.application.Actor;
import org.carball.scholarflow.model.application.Application;
import org.carball.scholarflow.model.application.ApplicationStatus;
import org.carball.scholarflow.model.application.Intent;
import org.carball.scholarflow.model.application.ReviewDecision;
import org.carball.scholarflow.model.application.ReviewStage;
import org.carball.scholarflow.model.application.StatusChange;
import org.carball.scholarflow.model.eligibility.EligibilityReport;
import org.carball.scholarflow.model.eligibility.ExemptionSet;
import org.carball.scholarflow.model.schema.FormSchema;
import org.carball.scholarflow.model.schema.MissingItem;
import org.carball.scholarflow.model.scholarship.ScholarshipType;
import org.carball.scholarflow.schema.SchemaRegistry;
import org.carball.scholarflow.whitelist.WhitelistStore;
import org.carball.scholarflow.workflow.ReviewAggregator.AggregateVerdict;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Applies one intent to one application. Guards run in a fixed order so callers always see the
 * same error for the same input:
 *
 * <ol>
 *   <li>the intent must be defined from the current status</li>
 *   <li>the actor's role and relationship must match a row</li>
 *   <li>on submit: the type must be open, a combined type needs a sub-scholarship</li>
 *   <li>on submit: every required field and document is present</li>
 *   <li>on submit: no hard rule fails without an exemption</li>
 * </ol>
 *
 * <p>All changes are made on a copy. The input application is never modified, so a failed guard
 * leaves the stored aggregate as it was.
 */
@Slf4j
public class ApplicationStateMachine {

    private final ScholarshipCatalog catalog;
    private final SchemaRegistry schemaRegistry;
    private final EligibilityEvaluator evaluator;
    private final WhitelistStore whitelistStore;
    private final ReviewAggregator aggregator;
    private final WorkflowSettings settings;
    private final Clock clock;

    public ApplicationStateMachine(ScholarshipCatalog catalog, SchemaRegistry schemaRegistry,
                                   EligibilityEvaluator evaluator, WhitelistStore whitelistStore,
                                   ReviewAggregator aggregator, WorkflowSettings settings, Clock clock) {
        this.catalog = catalog;
        this.schemaRegistry = schemaRegistry;
        this.evaluator = evaluator;
        this.whitelistStore = whitelistStore;
        this.aggregator = aggregator;
        this.settings = settings;
        this.clock = clock;
    }

    public Application transition(Application current, Intent intent, Actor actor, String comment) {
        List<TransitionRule> rules = TransitionTable.rulesFor(current.getStatus(), intent);
        if (rules.isEmpty()) {
            throw new IllegalTransitionException(current.getId(), current.getStatus(), intent);
        }

        TransitionRule rule = rules.stream()
                .filter(r -> r.allows(actor.role()))
                .findFirst()
                .orElseThrow(() -> new PermissionException(actor.id(), actor.role(), String.format(
                        "%s may not %s application %s", actor.role().getValue(), intent.getValue(), current.getId())));
        checkRelation(rule, current, actor);

        ScholarshipType type = catalog.require(current.getScholarshipTypeCode());
        Instant now = clock.instant();
        Application working = current.copy();

        if (intent == Intent.SUBMIT) {
            checkSubmission(working, type, now);
        }

        if (rule.recordsDecision()) {
            working.appendDecision(new ReviewDecision(working.getId(), rule.stage(), actor.id(), actor.role(),
                    rule.verdict(), comment, now, working.getReviewCycle()));
        }

        ApplicationStatus target = resolveTarget(rule, working, type, intent);
        if (rule.effect() == TransitionRule.Effect.RETURN) {
            working.setReviewCycle(working.getReviewCycle() + 1);
        }

        if (target != current.getStatus()) {
            working.setStatus(target);
            working.getStatusTimestamps().put(target, now);
            working.appendStatusChange(new StatusChange(current.getStatus(), target, intent, actor.id(), actor.role(), now));
            log.info("Application {} moved {} -> {} on '{}' by {} {}", working.getId(), current.getStatus().getValue(),
                    target.getValue(), intent.getValue(), actor.role().getValue(), actor.id());
        } else {
            log.info("Application {} recorded '{}' by {} {}; status remains {}", working.getId(), intent.getValue(),
                    actor.role().getValue(), actor.id(), target.getValue());
        }
        return working;
    }

    private void checkSubmission(Application working, ScholarshipType type, Instant now) {
        if (!type.isActive()) {
            throw new ValidationException("scholarship_type", "scholarship " + type.getCode() + " is no longer offered");
        }
        if (settings.isEnforceApplicationWindow() && !type.isWithinWindow(now)) {
            throw new ValidationException("application_window", String.format(
                    "scholarship %s is not accepting applications at %s", type.getCode(), now));
        }

        List<MissingItem> missing = new ArrayList<>();
        if (type.isCombined() && working.getSubScholarshipCode() == null) {
            missing.add(MissingItem.subScholarship());
        }
        FormSchema schema = schemaRegistry.getSchema(type.getCode(), working.getSubScholarshipCode());
        missing.addAll(schemaRegistry.findMissing(schema, working.getFieldValues(), working.getDocuments()));
        if (!missing.isEmpty()) {
            throw new IncompleteSubmissionException(working.getId(), missing);
        }

        ExemptionSet exemptions = whitelistStore.exemptionsAt(type.getCode(), working.getStudentId(), now);
        EligibilityReport report = evaluator.preview(working.getAcademicRecord(), type,
                working.getSubScholarshipCode(), exemptions);
        if (!report.isEligible()) {
            log.info("Application {} failed {} eligibility rule(s)", working.getId(), report.failed().size());
            throw new EligibilityException(working.getId(), report);
        }

        working.setEligibilityAudit(report);
        working.setWarnings(new ArrayList<>(report.warnings()));
        working.setSubmittedAt(now);
        if (!report.warnings().isEmpty()) {
            log.info("Application {} submitted with {} warning(s)", working.getId(), report.warnings().size());
        }
    }

    private ApplicationStatus resolveTarget(TransitionRule rule, Application working, ScholarshipType type, Intent intent) {
        switch (rule.effect()) {
            case MOVE, DECIDE, RETURN:
                return rule.target();
            case ROUTE:
                if (!type.isRequiresProfessorRecommendation()) {
                    return ApplicationStatus.COLLEGE_REVIEW;
                }
                if (working.getAdvisorIds().isEmpty()) {
                    throw new ValidationException("advisor_ids", "scholarship " + type.getCode()
                            + " requires a professor recommendation but no advisor is assigned");
                }
                return ApplicationStatus.PENDING_RECOMMENDATION;
            case AGGREGATE:
                AggregateVerdict verdict = aggregator.aggregate(working.getDecisions(), working.getReviewCycle(),
                        aggregator.requirementFor(working, type, rule.stage()));
                log.debug("Stage {} of application {} aggregates to {}", rule.stage().getValue(), working.getId(), verdict);
                return verdict == AggregateVerdict.APPROVE && rule.target() != null ? rule.target() : working.getStatus();
            case FINALIZE:
                Map<ReviewStage, AggregateVerdict> stages = aggregator.aggregateRequired(working, type);
                if (stages.values().stream().anyMatch(v -> v != AggregateVerdict.APPROVE)) {
                    throw new IllegalTransitionException(working.getId(), working.getStatus(), intent, String.format(
                            "Application %s cannot be approved before all review stages approve: %s",
                            working.getId(), describe(stages)));
                }
                return rule.target();
            default:
                throw new IllegalStateException("Unhandled effect " + rule.effect());
        }
    }

    private static void checkRelation(TransitionRule rule, Application application, Actor actor) {
        if (!rule.relatesTo(application, actor)) {
            throw new PermissionException(actor.id(), actor.role(), String.format("%s %s is not the %s of application %s",
                    actor.role().getValue(), actor.id(),
                    rule.relation() == TransitionRule.Relation.OWNER ? "owner" : "assigned advisor",
                    application.getId()));
        }
    }

    private static String describe(Map<ReviewStage, AggregateVerdict> stages) {
        return stages.entrySet().stream()
                .map(e -> e.getKey().getValue() + "=" + e.getValue().name().toLowerCase())
                .collect(Collectors.joining(", "));
    }
}
