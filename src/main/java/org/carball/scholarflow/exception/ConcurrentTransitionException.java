package org.carball.scholarflow.exception;

import lombok.Getter;

@Getter
public class ConcurrentTransitionException extends WorkflowException {

    private final String applicationId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrentTransitionException(String applicationId, long expectedVersion, long actualVersion) {
        super("CONCURRENT_MODIFICATION", String.format(
                "Application %s was modified concurrently (expected version %d, found %d)",
                applicationId, expectedVersion, actualVersion));
        this.applicationId = applicationId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
