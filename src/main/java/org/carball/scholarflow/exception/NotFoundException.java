package org.carball.scholarflow.exception;

public class NotFoundException extends WorkflowException {

    public NotFoundException(String resource, String identifier) {
        super("NOT_FOUND", resource + " not found: " + identifier);
    }
}
