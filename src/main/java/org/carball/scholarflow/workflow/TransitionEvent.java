package org.carball.scholarflow.workflow;

import org.carball.scholarflow.model.application.ApplicationStatus;
import org.carball.scholarflow.model.application.Intent;
import org.carball.scholarflow.model.application.Role;

import java.time.Instant;

/**
 * Published after a transition has been stored.
 */
public record TransitionEvent(
        String applicationId,
        Intent intent,
        ApplicationStatus fromStatus,
        ApplicationStatus toStatus,
        String actorId,
        Role actorRole,
        Instant at
) {
    public boolean statusChanged() {
        return fromStatus != toStatus;
    }
}
