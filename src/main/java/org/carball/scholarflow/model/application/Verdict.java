package org.carball.scholarflow.model.application;

import lombok.Getter;

@Getter
public enum Verdict {
    APPROVE("approve"),
    REJECT("reject"),
    RETURN_FOR_REVISION("return_for_revision");

    private final String value;

    Verdict(String value) {
        this.value = value;
    }
}
