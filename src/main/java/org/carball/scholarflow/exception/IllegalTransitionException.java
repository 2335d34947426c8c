package org.carball.scholarflow.exception;

import lombok.Getter;
import org.carball.scholarflow.model.application.ApplicationStatus;
import org.carball.scholarflow.model.application.Intent;

/**
 * The intent is not defined from the application's current status, or its preconditions on
 * review progress are not met yet.
 */
@Getter
public class IllegalTransitionException extends WorkflowException {

    private final String applicationId;
    private final ApplicationStatus status;
    private final Intent intent;

    public IllegalTransitionException(String applicationId, ApplicationStatus status, Intent intent) {
        this(applicationId, status, intent,
                String.format("Intent '%s' is not allowed for application %s in status '%s'",
                        intent.getValue(), applicationId, status.getValue()));
    }

    public IllegalTransitionException(String applicationId, ApplicationStatus status, Intent intent, String message) {
        super("ILLEGAL_TRANSITION", message);
        this.applicationId = applicationId;
        this.status = status;
        this.intent = intent;
    }
}
