package org.carball.scholarflow.exception;

import lombok.Getter;

import java.util.List;

/**
 * A structural change was requested on a schema entry that already has submitted data.
 */
@Getter
public class SchemaLockedException extends WorkflowException {

    private final String scholarshipTypeCode;
    private final String entryName;
    private final List<String> lockedAttributes;

    public SchemaLockedException(String scholarshipTypeCode, String entryName, List<String> lockedAttributes) {
        super("SCHEMA_LOCKED", String.format("'%s' of scholarship %s is in use; cannot change %s",
                entryName, scholarshipTypeCode, String.join(", ", lockedAttributes)));
        this.scholarshipTypeCode = scholarshipTypeCode;
        this.entryName = entryName;
        this.lockedAttributes = List.copyOf(lockedAttributes);
    }
}
