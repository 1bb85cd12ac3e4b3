package io.github.nabilcarel.gateway;

import io.github.nabilcarel.gateway.model.StepCoordinatorImpl;
import io.github.nabilcarel.gateway.model.composite.CompositeStep;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class StepCoordinatorImplTest {

    private static CompositeStep step(String name, String dependsOn) {
        return CompositeStep.builder().name(name).endpoint("Target").dependsOn(dependsOn).build();
    }

    private static List<String> drain(StepCoordinatorImpl coordinator) {
        List<String> order = new ArrayList<>();
        Optional<CompositeStep> next = coordinator.nextReady();
        while (next.isPresent()) {
            String name = next.get().getName();
            coordinator.markInProgress(name);
            coordinator.markResolved(name);
            order.add(name);
            next = coordinator.nextReady();
        }
        return order;
    }

    @Test
    void testNextReady_withNoDependencies_followsDeclaredOrder() {
        StepCoordinatorImpl coordinator = new StepCoordinatorImpl(List.of(step("a", null), step("b", null), step("c", null)));

        assertThat(drain(coordinator)).containsExactly("a", "b", "c");
        assertThat(coordinator.isCompositeResolved()).isTrue();
    }

    @Test
    void testNextReady_dependentDeclaredFirst_waitsForDependency() {
        StepCoordinatorImpl coordinator = new StepCoordinatorImpl(List.of(step("header", "lines"), step("lines", null)));

        assertThat(drain(coordinator)).containsExactly("lines", "header");
    }

    @Test
    void testNextReady_eligibleStepsKeepDocumentOrder() {
        StepCoordinatorImpl coordinator = new StepCoordinatorImpl(List.of(
                step("c", "a"),
                step("a", null),
                step("b", null),
                step("d", "b")));

        // after a resolves both c and b are eligible; c is declared first
        assertThat(drain(coordinator)).containsExactly("a", "c", "b", "d");
    }

    @Test
    void testNextReady_whileStepInProgress_returnsEmpty() {
        StepCoordinatorImpl coordinator = new StepCoordinatorImpl(List.of(step("a", null), step("b", null)));

        assertThat(coordinator.markInProgress("a")).isTrue();

        assertThat(coordinator.nextReady()).isEmpty();
    }

    @Test
    void testMarkResolved_requiresInProgress() {
        StepCoordinatorImpl coordinator = new StepCoordinatorImpl(List.of(step("a", null)));

        assertThat(coordinator.markResolved("a")).isFalse();
        assertThat(coordinator.markInProgress("a")).isTrue();
        assertThat(coordinator.markInProgress("a")).isFalse();
        assertThat(coordinator.markResolved("a")).isTrue();
        assertThat(coordinator.isResolved("a")).isTrue();
    }

    @Test
    void testNextReady_unresolvedDependency_leavesDependentPending() {
        StepCoordinatorImpl coordinator = new StepCoordinatorImpl(List.of(step("a", null), step("b", "a")));

        coordinator.markInProgress("a");

        assertThat(coordinator.nextReady()).isEmpty();
        assertThat(coordinator.isCompositeResolved()).isFalse();
        assertThat(coordinator.isResolved("b")).isFalse();
    }

    @Test
    void testConstructor_unknownDependency_throws() {
        assertThatThrownBy(() -> new StepCoordinatorImpl(List.of(step("a", "missing"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }
}
