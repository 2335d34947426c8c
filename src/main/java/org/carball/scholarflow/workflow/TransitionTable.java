package org.carball.scholarflow.workflow;

import org.carball.scholarflow.model.application.Actor;
import org.carball.scholarflow.model.application.Application;
import org.carball.scholarflow.model.application.ApplicationStatus;
import org.carball.scholarflow.model.application.Intent;
import org.carball.scholarflow.model.application.ReviewStage;
import org.carball.scholarflow.model.application.Role;
import org.carball.scholarflow.model.application.Verdict;
import org.carball.scholarflow.workflow.TransitionRule.Effect;
import org.carball.scholarflow.workflow.TransitionRule.Relation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.carball.scholarflow.model.application.ApplicationStatus.APPROVED;
import static org.carball.scholarflow.model.application.ApplicationStatus.COLLEGE_REVIEW;
import static org.carball.scholarflow.model.application.ApplicationStatus.DRAFT;
import static org.carball.scholarflow.model.application.ApplicationStatus.PENDING_RECOMMENDATION;
import static org.carball.scholarflow.model.application.ApplicationStatus.RECOMMENDED;
import static org.carball.scholarflow.model.application.ApplicationStatus.REJECTED;
import static org.carball.scholarflow.model.application.ApplicationStatus.SUBMITTED;
import static org.carball.scholarflow.model.application.ApplicationStatus.UNDER_REVIEW;
import static org.carball.scholarflow.model.application.ApplicationStatus.WITHDRAWN;

/**
 * Static transition table keyed by (status, intent). A pair with no rows is an illegal transition;
 * a pair with rows but none matching the actor's role is a permission failure.
 */
public final class TransitionTable {

    private static final Set<Role> ADMINS = EnumSet.of(Role.ADMIN, Role.SUPER_ADMIN);

    private static final Map<ApplicationStatus, Map<Intent, List<TransitionRule>>> RULES =
            new EnumMap<>(ApplicationStatus.class);

    static {
        Set<Role> student = EnumSet.of(Role.STUDENT);
        Set<Role> professor = EnumSet.of(Role.PROFESSOR);
        Set<Role> college = EnumSet.of(Role.COLLEGE);
        Set<Role> reviewOpeners = EnumSet.of(Role.COLLEGE, Role.ADMIN, Role.SUPER_ADMIN);

        add(DRAFT, Intent.SUBMIT, student, Relation.OWNER, Effect.MOVE, SUBMITTED, null, null);
        add(DRAFT, Intent.WITHDRAW, student, Relation.OWNER, Effect.MOVE, WITHDRAWN, null, null);
        add(SUBMITTED, Intent.WITHDRAW, student, Relation.OWNER, Effect.MOVE, WITHDRAWN, null, null);
        add(SUBMITTED, Intent.START_REVIEW, reviewOpeners, Relation.ANY, Effect.MOVE, UNDER_REVIEW, null, null);

        add(UNDER_REVIEW, Intent.FORWARD, ADMINS, Relation.ANY, Effect.ROUTE, null, null, null);
        add(RECOMMENDED, Intent.FORWARD, ADMINS, Relation.ANY, Effect.MOVE, COLLEGE_REVIEW, null, null);

        add(PENDING_RECOMMENDATION, Intent.RECOMMEND, professor, Relation.ASSIGNED_ADVISOR, Effect.AGGREGATE,
                RECOMMENDED, ReviewStage.PROFESSOR_RECOMMENDATION, Verdict.APPROVE);
        add(PENDING_RECOMMENDATION, Intent.DECLINE, professor, Relation.ASSIGNED_ADVISOR, Effect.DECIDE,
                REJECTED, ReviewStage.PROFESSOR_RECOMMENDATION, Verdict.REJECT);
        add(PENDING_RECOMMENDATION, Intent.RETURN, professor, Relation.ASSIGNED_ADVISOR, Effect.RETURN,
                DRAFT, ReviewStage.PROFESSOR_RECOMMENDATION, Verdict.RETURN_FOR_REVISION);

        add(COLLEGE_REVIEW, Intent.APPROVE, college, Relation.ANY, Effect.AGGREGATE,
                null, ReviewStage.COLLEGE_REVIEW, Verdict.APPROVE);
        add(COLLEGE_REVIEW, Intent.REJECT, college, Relation.ANY, Effect.DECIDE,
                REJECTED, ReviewStage.COLLEGE_REVIEW, Verdict.REJECT);
        add(COLLEGE_REVIEW, Intent.RETURN, college, Relation.ANY, Effect.RETURN,
                DRAFT, ReviewStage.COLLEGE_REVIEW, Verdict.RETURN_FOR_REVISION);
        add(COLLEGE_REVIEW, Intent.APPROVE, ADMINS, Relation.ANY, Effect.FINALIZE,
                APPROVED, ReviewStage.COMMITTEE_DECISION, Verdict.APPROVE);

        for (ApplicationStatus status : List.of(UNDER_REVIEW, PENDING_RECOMMENDATION, RECOMMENDED, COLLEGE_REVIEW)) {
            add(status, Intent.REJECT, ADMINS, Relation.ANY, Effect.DECIDE,
                    REJECTED, ReviewStage.COMMITTEE_DECISION, Verdict.REJECT);
            add(status, Intent.RETURN, ADMINS, Relation.ANY, Effect.RETURN,
                    DRAFT, ReviewStage.COMMITTEE_DECISION, Verdict.RETURN_FOR_REVISION);
        }
    }

    private TransitionTable() {
    }

    private static void add(ApplicationStatus from, Intent intent, Set<Role> roles, Relation relation,
                            Effect effect, ApplicationStatus target, ReviewStage stage, Verdict verdict) {
        RULES.computeIfAbsent(from, s -> new EnumMap<>(Intent.class))
                .computeIfAbsent(intent, i -> new ArrayList<>())
                .add(new TransitionRule(from, intent, roles, relation, effect, target, stage, verdict));
    }

    /**
     * Rows defined for the pair, empty when the intent is illegal from the status.
     */
    public static List<TransitionRule> rulesFor(ApplicationStatus status, Intent intent) {
        return Collections.unmodifiableList(RULES.getOrDefault(status, Map.of()).getOrDefault(intent, List.of()));
    }

    public static boolean isDefined(ApplicationStatus status, Intent intent) {
        return !rulesFor(status, intent).isEmpty();
    }

    /**
     * Intents the actor could attempt on the application right now. Guards that depend on the
     * application's content, such as completeness or review progress, are not checked.
     */
    public static Set<Intent> permittedIntents(Application application, Actor actor) {
        Set<Intent> intents = EnumSet.noneOf(Intent.class);
        RULES.getOrDefault(application.getStatus(), Map.of()).forEach((intent, rules) -> {
            if (rules.stream().anyMatch(rule -> rule.allows(actor.role()) && rule.relatesTo(application, actor))) {
                intents.add(intent);
            }
        });
        return intents;
    }
}
