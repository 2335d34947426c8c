package org.carball.scholarflow.exception;

import lombok.Getter;

/**
 * Base exception for workflow and eligibility errors. Every subclass carries a stable error code
 * so callers can render structured feedback without parsing messages.
 */
@Getter
public abstract class WorkflowException extends RuntimeException {

    private final String errorCode;

    protected WorkflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected WorkflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
