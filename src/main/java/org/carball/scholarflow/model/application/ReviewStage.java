package org.carball.scholarflow.model.application;

import lombok.Getter;

@Getter
public enum ReviewStage {
    PROFESSOR_RECOMMENDATION("professor_recommendation"),
    COLLEGE_REVIEW("college_review"),
    COMMITTEE_DECISION("committee_decision");

    private final String value;

    ReviewStage(String value) {
        this.value = value;
    }
}
