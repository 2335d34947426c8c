package org.carball.scholarflow.exception;

import lombok.Getter;

/**
 * Scholarship reference data is frozen once applications exist, apart from window dates and
 * rule activation flags.
 */
@Getter
public class CatalogLockedException extends WorkflowException {

    private final String scholarshipTypeCode;

    public CatalogLockedException(String scholarshipTypeCode, String change) {
        super("CATALOG_LOCKED", String.format(
                "Scholarship %s has applications; %s is not allowed", scholarshipTypeCode, change));
        this.scholarshipTypeCode = scholarshipTypeCode;
    }
}
