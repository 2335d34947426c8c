package org.carball.scholarflow.model.application;

import java.util.Objects;

public record Actor(String id, Role role) {

    public Actor {
        Objects.requireNonNull(id, "actor id");
        Objects.requireNonNull(role, "actor role");
    }

    public static Actor student(String id) {
        return new Actor(id, Role.STUDENT);
    }

    public static Actor professor(String id) {
        return new Actor(id, Role.PROFESSOR);
    }

    public static Actor college(String id) {
        return new Actor(id, Role.COLLEGE);
    }

    public static Actor admin(String id) {
        return new Actor(id, Role.ADMIN);
    }
}
