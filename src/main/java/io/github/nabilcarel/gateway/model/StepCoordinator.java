package io.github.nabilcarel.gateway.model;

import io.github.nabilcarel.gateway.model.composite.CompositeStep;

import java.util.Optional;

public interface StepCoordinator {

    /**
     * The first pending step, in declared order, whose dependency has resolved.
     */
    Optional<CompositeStep> nextReady();

    boolean markInProgress(String stepName);

    boolean markResolved(String stepName);

    boolean isResolved(String stepName);

    boolean isCompositeResolved();
}
