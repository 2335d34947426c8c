package org.carball.scholarflow.model.application;

import java.time.Instant;

public record StatusChange(
        ApplicationStatus from,
        ApplicationStatus to,
        Intent intent,
        String actorId,
        Role actorRole,
        Instant at
) {}
