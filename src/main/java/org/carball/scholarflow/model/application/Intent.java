package org.carball.scholarflow.model.application;

import lombok.Getter;

@Getter
public enum Intent {
    SUBMIT("submit"),
    START_REVIEW("start_review"),
    FORWARD("forward"),
    RECOMMEND("recommend"),
    DECLINE("decline"),
    APPROVE("approve"),
    REJECT("reject"),
    WITHDRAW("withdraw"),
    RETURN("return");

    private final String value;

    Intent(String value) {
        this.value = value;
    }

    public static Intent fromValue(String value) {
        for (Intent intent : values()) {
            if (intent.value.equalsIgnoreCase(value)) {
                return intent;
            }
        }
        throw new IllegalArgumentException("Unknown intent: " + value);
    }
}
