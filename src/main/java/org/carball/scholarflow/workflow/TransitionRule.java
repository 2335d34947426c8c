package org.carball.scholarflow.workflow;

import org.carball.scholarflow.model.application.Actor;
import org.carball.scholarflow.model.application.Application;
import org.carball.scholarflow.model.application.ApplicationStatus;
import org.carball.scholarflow.model.application.Intent;
import org.carball.scholarflow.model.application.ReviewStage;
import org.carball.scholarflow.model.application.Role;
import org.carball.scholarflow.model.application.Verdict;

import java.util.Set;

/**
 * One row of the transition table.
 *
 * @param target  status entered on success; for {@link Effect#AGGREGATE} the status entered once the
 *                stage aggregates to approve, or {@code null} to stay put
 * @param stage   review stage the recorded decision belongs to, when the row records one
 * @param verdict verdict of the recorded decision
 */
public record TransitionRule(
        ApplicationStatus from,
        Intent intent,
        Set<Role> roles,
        Relation relation,
        Effect effect,
        ApplicationStatus target,
        ReviewStage stage,
        Verdict verdict
) {

    /**
     * Relationship the acting user must have with the application on top of holding a role.
     */
    public enum Relation {
        ANY,
        OWNER,
        ASSIGNED_ADVISOR
    }

    public enum Effect {
        /** Move to the target status. */
        MOVE,
        /** Move to a status chosen from the scholarship type's review requirements. */
        ROUTE,
        /** Record a decision and move on only when the stage aggregates to approve. */
        AGGREGATE,
        /** Record a decision and move to the target status. */
        DECIDE,
        /** Record the committee approval once every required stage has approved. */
        FINALIZE,
        /** Record a return-for-revision decision and reopen the application as a draft. */
        RETURN
    }

    public TransitionRule {
        roles = Set.copyOf(roles);
    }

    public boolean recordsDecision() {
        return stage != null;
    }

    public boolean allows(Role role) {
        return roles.contains(role);
    }

    public boolean relatesTo(Application application, Actor actor) {
        return switch (relation) {
            case ANY -> true;
            case OWNER -> application.isOwnedBy(actor.id());
            case ASSIGNED_ADVISOR -> application.hasAdvisor(actor.id());
        };
    }
}
