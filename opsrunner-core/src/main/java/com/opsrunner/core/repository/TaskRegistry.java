package com.opsrunner.core.repository;

import com.opsrunner.core.model.TaskInfo;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Registry of orchestrator tasks keyed by task id.
 *
 * Every mutation touches exactly one entry and is atomic for that entry;
 * readers of other entries are never blocked. Readers always receive
 * immutable copies, never a live view.
 */
public interface TaskRegistry {

    /**
     * Insert a newly submitted task.
     *
     * @throws IllegalStateException if a task with the same id is already tracked
     */
    void register(TaskInfo task);

    /**
     * Atomically replace a task with the result of applying the updater to it.
     *
     * @param taskId The task ID
     * @param updater Function from the current entry to its replacement
     * @return The updated task, or empty if the task is not tracked
     */
    Optional<TaskInfo> update(UUID taskId, UnaryOperator<TaskInfo> updater);

    /**
     * Find a task by ID.
     */
    Optional<TaskInfo> find(UUID taskId);

    /**
     * Consistent copy of every tracked task, oldest first.
     */
    List<TaskInfo> snapshot();

    /**
     * Remove a task.
     *
     * @return true if the task was tracked
     */
    boolean remove(UUID taskId);

    /**
     * Remove every task matching the predicate, evaluated per entry.
     *
     * @return The number of tasks removed
     */
    int removeIf(Predicate<TaskInfo> predicate);

    /**
     * Count tracked tasks.
     */
    int size();
}
