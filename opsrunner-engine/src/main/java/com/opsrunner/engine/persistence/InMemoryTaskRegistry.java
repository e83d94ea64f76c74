package com.opsrunner.engine.persistence;

import com.opsrunner.core.exception.InvalidStateTransitionException;
import com.opsrunner.core.model.TaskInfo;
import com.opsrunner.core.repository.TaskRegistry;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of TaskRegistry.
 * Per-entry atomicity comes from {@link ConcurrentHashMap#compute}; an update
 * that would move a task's status backwards throws and leaves the entry as it was.
 */
public class InMemoryTaskRegistry implements TaskRegistry {

    private final Map<UUID, TaskInfo> tasks = new ConcurrentHashMap<>();

    @Override
    public void register(TaskInfo task) {
        if (tasks.putIfAbsent(task.id(), task) != null) {
            throw new IllegalStateException("Task already registered: " + task.id());
        }
    }

    @Override
    public Optional<TaskInfo> update(UUID taskId, UnaryOperator<TaskInfo> updater) {
        return Optional.ofNullable(tasks.computeIfPresent(taskId, (id, current) -> {
            TaskInfo updated = updater.apply(current);
            if (updated.status() != current.status() && !current.status().canTransitionTo(updated.status())) {
                throw new InvalidStateTransitionException("Task", current.status().name(), updated.status().name());
            }
            return updated;
        }));
    }

    @Override
    public Optional<TaskInfo> find(UUID taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<TaskInfo> snapshot() {
        return tasks.values().stream()
            .sorted(Comparator.comparing(TaskInfo::createdAt))
            .toList();
    }

    @Override
    public boolean remove(UUID taskId) {
        return tasks.remove(taskId) != null;
    }

    @Override
    public int removeIf(Predicate<TaskInfo> predicate) {
        AtomicInteger removed = new AtomicInteger();
        for (UUID id : tasks.keySet()) {
            tasks.computeIfPresent(id, (key, task) -> {
                if (predicate.test(task)) {
                    removed.incrementAndGet();
                    return null;
                }
                return task;
            });
        }
        return removed.get();
    }

    @Override
    public int size() {
        return tasks.size();
    }
}
