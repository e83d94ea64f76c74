package com.opsrunner.engine.scheduler;

import com.opsrunner.core.exception.CyclicDependencyException;
import com.opsrunner.core.exception.DependencyNotFoundException;
import com.opsrunner.core.exception.WorkflowValidationException;
import com.opsrunner.core.model.WorkflowStep;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the execution order of a workflow's steps.
 *
 * Depth-first topological sort over the step list: every step is emitted
 * after all of its transitive dependencies, independent steps keep their
 * declaration order. The result is a total order; the engine runs it one
 * step at a time.
 *
 * Pure and synchronous, safe to share between threads.
 */
public class StepScheduler {

    private static final byte UNVISITED = 0;
    private static final byte VISITING = 1;
    private static final byte VISITED = 2;

    /**
     * Order the steps so that dependencies come first.
     *
     * @param steps Steps in declaration order
     * @return The same steps in execution order
     * @throws DependencyNotFoundException if a step depends on an unknown id
     * @throws CyclicDependencyException if the dependency graph has a cycle
     * @throws WorkflowValidationException if two steps share an id
     */
    public List<WorkflowStep> order(List<WorkflowStep> steps) {
        Map<String, Integer> indexById = indexSteps(steps);
        int[][] dependencies = resolveDependencies(steps, indexById);

        byte[] marks = new byte[steps.size()];
        List<WorkflowStep> sorted = new ArrayList<>(steps.size());

        for (int i = 0; i < steps.size(); i++) {
            if (marks[i] == UNVISITED) {
                visit(i, steps, dependencies, marks, sorted);
            }
        }
        return List.copyOf(sorted);
    }

    private void visit(int index, List<WorkflowStep> steps, int[][] dependencies,
                       byte[] marks, List<WorkflowStep> sorted) {
        if (marks[index] == VISITING) {
            throw new CyclicDependencyException(steps.get(index).id());
        }
        if (marks[index] == VISITED) {
            return;
        }

        marks[index] = VISITING;
        for (int dependency : dependencies[index]) {
            visit(dependency, steps, dependencies, marks, sorted);
        }
        marks[index] = VISITED;
        sorted.add(steps.get(index));
    }

    private Map<String, Integer> indexSteps(List<WorkflowStep> steps) {
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            String id = steps.get(i).id();
            if (id == null || id.isBlank()) {
                throw new WorkflowValidationException(id, "Step at position " + i + " has no id");
            }
            if (indexById.putIfAbsent(id, i) != null) {
                throw new WorkflowValidationException(id, "Duplicate step id: " + id);
            }
        }
        return indexById;
    }

    // Adjacency built once; edges point from a step to the steps it waits for
    private int[][] resolveDependencies(List<WorkflowStep> steps, Map<String, Integer> indexById) {
        int[][] dependencies = new int[steps.size()][];
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            List<String> dependsOn = step.dependsOn();
            dependencies[i] = new int[dependsOn.size()];
            for (int d = 0; d < dependsOn.size(); d++) {
                Integer target = indexById.get(dependsOn.get(d));
                if (target == null) {
                    throw new DependencyNotFoundException(step.id(), dependsOn.get(d));
                }
                dependencies[i][d] = target;
            }
        }
        return dependencies;
    }
}
