package org.carball.scholarflow.model.application;

import java.time.Instant;

/**
 * A pointer to an uploaded file, tagged with the document requirement it satisfies.
 * File bytes live with the storage collaborator.
 */
public record DocumentReference(String documentName, String reference, Instant attachedAt) {}
