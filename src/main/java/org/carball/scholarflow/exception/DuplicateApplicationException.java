package org.carball.scholarflow.exception;

import lombok.Getter;

@Getter
public class DuplicateApplicationException extends WorkflowException {

    private final String studentId;
    private final String scholarshipTypeCode;

    public DuplicateApplicationException(String studentId, String scholarshipTypeCode, int limit) {
        super("DUPLICATE_APPLICATION", String.format(
                "Student %s already has %d active application(s) for scholarship %s",
                studentId, limit, scholarshipTypeCode));
        this.studentId = studentId;
        this.scholarshipTypeCode = scholarshipTypeCode;
    }
}
