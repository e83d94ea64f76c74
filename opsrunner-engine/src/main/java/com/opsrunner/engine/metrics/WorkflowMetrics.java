package com.opsrunner.engine.metrics;

import com.opsrunner.core.model.ExecutionStatus;
import com.opsrunner.core.model.TaskStatus;
import com.opsrunner.core.model.TaskType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the runner.
 *
 * Metrics exposed:
 * - Workflow runs started / completed / failed
 * - Step outcomes, retries and duration
 * - Tasks submitted by type, tasks currently in each status
 * - Concurrency permits in use
 */
public class WorkflowMetrics {

    public static final String WORKFLOW_STARTED = "opsrunner.workflows.started";
    public static final String WORKFLOW_COMPLETED = "opsrunner.workflows.completed";
    public static final String WORKFLOW_FAILED = "opsrunner.workflows.failed";

    public static final String STEP_DURATION = "opsrunner.step.duration";
    public static final String STEP_OUTCOMES = "opsrunner.steps";
    public static final String STEP_RETRIES = "opsrunner.step.retries";

    public static final String TASKS_SUBMITTED = "opsrunner.tasks.submitted";
    public static final String TASK_COUNT = "opsrunner.tasks";
    public static final String PERMITS_IN_USE = "opsrunner.permits.in_use";

    private final MeterRegistry registry;
    private final Map<TaskStatus, AtomicInteger> taskStatusGauges = new EnumMap<>(TaskStatus.class);
    private final AtomicInteger permitsInUse = new AtomicInteger();

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;

        for (TaskStatus status : TaskStatus.values()) {
            AtomicInteger gauge = new AtomicInteger(0);
            taskStatusGauges.put(status, gauge);
            Gauge.builder(TASK_COUNT, gauge, AtomicInteger::get)
                .tag("status", status.name())
                .description("Number of tracked tasks in " + status + " status")
                .register(registry);
        }

        Gauge.builder(PERMITS_IN_USE, permitsInUse, AtomicInteger::get)
            .description("Concurrency permits currently held by task bodies")
            .register(registry);
    }

    // ========== Workflow Metrics ==========

    public void workflowStarted(String workflowName) {
        counter(WORKFLOW_STARTED, "workflow", workflowName).increment();
    }

    public void workflowCompleted(String workflowName) {
        counter(WORKFLOW_COMPLETED, "workflow", workflowName).increment();
    }

    public void workflowFailed(String workflowName) {
        counter(WORKFLOW_FAILED, "workflow", workflowName).increment();
    }

    // ========== Step Metrics ==========

    public void stepFinished(ExecutionStatus status, Duration duration) {
        counter(STEP_OUTCOMES, "status", status.name()).increment();
        Timer.builder(STEP_DURATION)
            .tag("status", status.name())
            .description("Step execution time including retries and backoff")
            .register(registry)
            .record(duration);
    }

    public void stepRetried(String stepId) {
        counter(STEP_RETRIES, "step", stepId).increment();
    }

    // ========== Task Metrics ==========

    public void taskSubmitted(TaskType type) {
        counter(TASKS_SUBMITTED, "type", type.name()).increment();
        taskStatusGauges.get(TaskStatus.PENDING).incrementAndGet();
    }

    public void taskTransitioned(TaskStatus from, TaskStatus to) {
        taskStatusGauges.get(from).decrementAndGet();
        taskStatusGauges.get(to).incrementAndGet();
    }

    public void tasksRemoved(TaskStatus status, int count) {
        taskStatusGauges.get(status).addAndGet(-count);
    }

    public void permitAcquired() {
        permitsInUse.incrementAndGet();
    }

    public void permitReleased() {
        permitsInUse.decrementAndGet();
    }

    public int tasksInStatus(TaskStatus status) {
        return taskStatusGauges.get(status).get();
    }

    public int permitsInUse() {
        return permitsInUse.get();
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        return Counter.builder(name)
            .tag(tagKey, tagValue == null ? "unknown" : tagValue)
            .register(registry);
    }
}
