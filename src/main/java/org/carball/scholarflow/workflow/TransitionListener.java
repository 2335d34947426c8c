package org.carball.scholarflow.workflow;

@FunctionalInterface
public interface TransitionListener {

    void onTransition(TransitionEvent event);
}
