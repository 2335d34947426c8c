package org.carball.scholarflow.model.application;

import lombok.Getter;

@Getter
public enum Role {
    STUDENT("student"),
    PROFESSOR("professor"),
    COLLEGE("college"),
    ADMIN("admin"),
    SUPER_ADMIN("super_admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    public boolean isAdministrative() {
        return this == ADMIN || this == SUPER_ADMIN;
    }

    public static Role fromValue(String value) {
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
