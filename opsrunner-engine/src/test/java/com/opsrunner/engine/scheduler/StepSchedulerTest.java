package com.opsrunner.engine.scheduler;

import com.opsrunner.core.exception.CyclicDependencyException;
import com.opsrunner.core.exception.DependencyNotFoundException;
import com.opsrunner.core.exception.WorkflowValidationException;
import com.opsrunner.core.model.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StepSchedulerTest {

    private final StepScheduler scheduler = new StepScheduler();

    private static WorkflowStep step(String id, String... dependsOn) {
        return WorkflowStep.builder().id(id).command("true").dependsOn(dependsOn).build();
    }

    private static List<String> ids(List<WorkflowStep> steps) {
        return steps.stream().map(WorkflowStep::id).toList();
    }

    @Test
    @DisplayName("Dependencies are placed before their dependents")
    void dependenciesFirst() {
        List<WorkflowStep> steps = List.of(
            step("deploy", "build", "test"),
            step("test", "build"),
            step("build")
        );

        assertThat(ids(scheduler.order(steps))).containsExactly("build", "test", "deploy");
    }

    @Test
    @DisplayName("Independent steps keep declaration order")
    void independentStepsKeepDeclarationOrder() {
        List<WorkflowStep> steps = List.of(step("c"), step("a"), step("b"));

        assertThat(ids(scheduler.order(steps))).containsExactly("c", "a", "b");
    }

    @Test
    @DisplayName("Diamond graph emits each step once, after all its dependencies")
    void diamond() {
        List<WorkflowStep> steps = List.of(
            step("join", "left", "right"),
            step("left", "root"),
            step("right", "root"),
            step("root")
        );

        List<String> order = ids(scheduler.order(steps));

        assertThat(order).containsExactly("root", "left", "right", "join");
    }

    @Test
    @DisplayName("Every step appears after all its transitive dependencies")
    void transitiveOrdering() {
        List<WorkflowStep> steps = List.of(
            step("e", "d"),
            step("a"),
            step("d", "b", "c"),
            step("c", "a"),
            step("b", "a")
        );

        List<String> order = ids(scheduler.order(steps));

        assertThat(order).hasSize(5).doesNotHaveDuplicates();
        for (WorkflowStep s : steps) {
            for (String dep : s.dependsOn()) {
                assertThat(order.indexOf(dep)).isLessThan(order.indexOf(s.id()));
            }
        }
    }

    @Test
    @DisplayName("Two-step cycle is reported at the step where it was re-entered")
    void twoStepCycle() {
        List<WorkflowStep> steps = List.of(step("a", "b"), step("b", "a"));

        assertThatThrownBy(() -> scheduler.order(steps))
            .isInstanceOf(CyclicDependencyException.class)
            .hasMessage("Circular dependency detected for step: a")
            .extracting(e -> ((CyclicDependencyException) e).getStepId())
            .isEqualTo("a");
    }

    @Test
    @DisplayName("Self dependency is a cycle")
    void selfDependency() {
        assertThatThrownBy(() -> scheduler.order(List.of(step("loop", "loop"))))
            .isInstanceOf(CyclicDependencyException.class)
            .hasMessageContaining("loop");
    }

    @Test
    @DisplayName("Unknown dependency names the missing id and the referencing step")
    void unknownDependency() {
        List<WorkflowStep> steps = List.of(step("a"), step("b", "ghost"));

        assertThatThrownBy(() -> scheduler.order(steps))
            .isInstanceOfSatisfying(DependencyNotFoundException.class, e -> {
                assertThat(e.getDependencyId()).isEqualTo("ghost");
                assertThat(e.getStepId()).isEqualTo("b");
            });
    }

    @Test
    @DisplayName("Duplicate step ids are rejected")
    void duplicateIds() {
        List<WorkflowStep> steps = List.of(step("a"), step("a"));

        assertThatThrownBy(() -> scheduler.order(steps))
            .isExactlyInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("Duplicate step id: a");
    }

    @Test
    void emptyWorkflowHasEmptyOrder() {
        assertThat(scheduler.order(List.of())).isEmpty();
    }
}
