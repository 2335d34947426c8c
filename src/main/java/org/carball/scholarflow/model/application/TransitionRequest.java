package org.carball.scholarflow.model.application;

/**
 * Inbound actor intent against one application.
 */
public record TransitionRequest(
        String applicationId,
        Intent intent,
        String actorId,
        Role actorRole,
        String comment
) {
    public static TransitionRequest of(String applicationId, Intent intent, Actor actor) {
        return new TransitionRequest(applicationId, intent, actor.id(), actor.role(), null);
    }

    public static TransitionRequest of(String applicationId, Intent intent, Actor actor, String comment) {
        return new TransitionRequest(applicationId, intent, actor.id(), actor.role(), comment);
    }

    public Actor actor() {
        return new Actor(actorId, actorRole);
    }
}
