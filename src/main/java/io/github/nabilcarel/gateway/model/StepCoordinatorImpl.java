package io.github.nabilcarel.gateway.model;

import io.github.nabilcarel.gateway.model.composite.CompositeStep;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks which steps of one composite execution are pending, running or done.
 * Steps run one at a time, so at most one step is ever in progress.
 */
public class StepCoordinatorImpl implements StepCoordinator {

    public enum State {
        PENDING,
        IN_PROGRESS,
        RESOLVED
    }

    private static class StepNode {
        private final CompositeStep step;
        private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);

        private StepNode(CompositeStep step) {
            this.step = step;
        }

        private State getState() {
            return state.get();
        }
    }

    private final Map<String, StepNode> nodes = new LinkedHashMap<>();

    public StepCoordinatorImpl(List<CompositeStep> steps) {
        for (CompositeStep step : steps) {
            nodes.put(step.getName(), new StepNode(step));
        }
        for (StepNode node : nodes.values()) {
            String dependency = node.step.getDependsOn();
            if (dependency != null && !nodes.containsKey(dependency)) {
                throw new IllegalArgumentException("Unknown dependency: " + dependency);
            }
        }
    }

    @Override
    public Optional<CompositeStep> nextReady() {
        if (nodes.values().stream().anyMatch(node -> node.getState() == State.IN_PROGRESS)) {
            return Optional.empty();
        }
        return nodes.values().stream()
                .filter(node -> node.getState() == State.PENDING)
                .filter(node -> node.step.getDependsOn() == null || isResolved(node.step.getDependsOn()))
                .map(node -> node.step)
                .findFirst();
    }

    @Override
    public boolean markInProgress(String stepName) {
        StepNode node = nodes.get(stepName);
        return node != null && node.state.compareAndSet(State.PENDING, State.IN_PROGRESS);
    }

    @Override
    public boolean markResolved(String stepName) {
        StepNode node = nodes.get(stepName);
        return node != null && node.state.compareAndSet(State.IN_PROGRESS, State.RESOLVED);
    }

    @Override
    public boolean isResolved(String stepName) {
        StepNode node = nodes.get(stepName);
        return node != null && node.getState() == State.RESOLVED;
    }

    @Override
    public boolean isCompositeResolved() {
        return nodes.values().stream().allMatch(node -> node.getState() == State.RESOLVED);
    }
}
