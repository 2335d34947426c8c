package org.carball.scholarflow.exception;

import lombok.Getter;
import org.carball.scholarflow.model.application.Role;

@Getter
public class PermissionException extends WorkflowException {

    private final String actorId;
    private final Role actorRole;

    public PermissionException(String actorId, Role actorRole, String message) {
        super("PERMISSION_DENIED", message);
        this.actorId = actorId;
        this.actorRole = actorRole;
    }
}
