package org.carball.scholarflow.model.whitelist;

import java.time.Instant;
import java.util.Set;

public record WhitelistEvent(
        Action action,
        String entryId,
        String scholarshipTypeCode,
        String studentId,
        Set<Long> ruleIds,
        String actorId,
        String justification,
        Instant at
) {
    public enum Action {
        GRANTED,
        REVOKED
    }
}
