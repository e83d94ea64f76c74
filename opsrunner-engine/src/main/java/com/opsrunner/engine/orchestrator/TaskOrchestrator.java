package com.opsrunner.engine.orchestrator;

import com.opsrunner.core.exception.InvalidStateTransitionException;
import com.opsrunner.core.model.TaskInfo;
import com.opsrunner.core.model.TaskStatus;
import com.opsrunner.core.model.TaskType;
import com.opsrunner.core.model.UploadInfo;
import com.opsrunner.core.model.WorkflowExecution;
import com.opsrunner.core.repository.TaskRegistry;
import com.opsrunner.engine.config.UploadSettings;
import com.opsrunner.engine.config.WorkflowSettings;
import com.opsrunner.engine.logging.LoggingContext;
import com.opsrunner.engine.metrics.WorkflowMetrics;
import com.opsrunner.engine.service.UploadService;
import com.opsrunner.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Entry point for running workflows and uploads as tracked tasks.
 *
 * Each submission is registered PENDING, waits for a concurrency permit on
 * the worker pool, runs its body as RUNNING and ends COMPLETED or FAILED.
 * At most {@code maxConcurrentWorkflows} bodies hold a permit at once.
 * Uploads use the same permits unless configured with their own limiter.
 */
public class TaskOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    static final Duration RETENTION = Duration.ofHours(24);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final WorkflowService workflowService;
    private final UploadService uploadService;
    private final TaskRegistry registry;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    private final Semaphore workflowPermits;
    private final Semaphore uploadPermits;
    private final ExecutorService workers;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public TaskOrchestrator(
            WorkflowService workflowService,
            UploadService uploadService,
            TaskRegistry registry,
            WorkflowSettings workflowSettings,
            UploadSettings uploadSettings,
            WorkflowMetrics metrics,
            Clock clock) {
        this.workflowService = workflowService;
        this.uploadService = uploadService;
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;

        this.workflowPermits = new Semaphore(workflowSettings.maxConcurrentWorkflows(), true);
        this.uploadPermits = uploadSettings.sharedLimiter()
            ? workflowPermits
            : new Semaphore(uploadSettings.maxConcurrentUploads(), true);

        // Unbounded: workers block on the permits, not on pool capacity
        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "opsrunner-task-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // ========== Submission ==========

    /**
     * Run a workflow definition as a tracked task.
     */
    public TaskHandle<WorkflowExecution> submitWorkflow(Path definitionPath) {
        return submit(TaskType.WORKFLOW, definitionPath, workflowPermits,
            () -> workflowService.executeWorkflow(definitionPath));
    }

    /**
     * Process a file through the upload pipeline as a tracked task.
     */
    public TaskHandle<UploadInfo> submitUpload(Path filePath) {
        return submit(TaskType.UPLOAD, filePath, uploadPermits,
            () -> uploadService.process(filePath));
    }

    private <T> TaskHandle<T> submit(TaskType type, Path subject, Semaphore permits, Supplier<T> body) {
        if (shuttingDown.get()) {
            throw new IllegalStateException("Cannot accept new tasks during shutdown");
        }

        TaskInfo task = TaskInfo.create(type, subject.toString(), clock.instant());
        registry.register(task);
        metrics.taskSubmitted(type);
        log.info("Submitted {} task {} for {}", type, task.id(), subject);

        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            workers.execute(() -> runTask(task, permits, body, result));
        } catch (RejectedExecutionException e) {
            transition(task.id(), t -> t.withFailed("Rejected: orchestrator is shut down", clock.instant()));
            throw new IllegalStateException("Cannot accept new tasks during shutdown", e);
        }
        return new TaskHandle<>(task.id(), result);
    }

    private <T> void runTask(TaskInfo task, Semaphore permits, Supplier<T> body, CompletableFuture<T> result) {
        try (var ctx = LoggingContext.forTask(task.id(), task.taskType().name())) {
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                transition(task.id(), t -> t.withFailed("Interrupted while waiting for a permit", clock.instant()));
                result.completeExceptionally(e);
                return;
            }

            metrics.permitAcquired();
            try {
                transition(task.id(), t -> t.withRunning(clock.instant()));
                T value = body.get();
                transition(task.id(), t -> t.withCompleted(clock.instant()));
                log.info("Task {} completed", task.id());
                result.complete(value);
            } catch (RuntimeException e) {
                transition(task.id(), t -> t.withFailed(describe(e), clock.instant()));
                log.error("Task {} failed: {}", task.id(), describe(e));
                result.completeExceptionally(e);
            } finally {
                permits.release();
                metrics.permitReleased();
            }
        }
    }

    // ========== Queries ==========

    public Optional<TaskInfo> getTaskStatus(UUID taskId) {
        return registry.find(taskId);
    }

    /**
     * Snapshot of every tracked task, oldest first, including finished ones
     * that cleanup has not removed yet.
     */
    public List<TaskInfo> listActiveTasks() {
        return registry.snapshot();
    }

    // ========== Cancellation and cleanup ==========

    /**
     * Mark a task CANCELLED. Bookkeeping only: a body that is already running
     * is not interrupted, and its later outcome no longer changes the status.
     *
     * @return true if the task was tracked and not yet finished
     */
    public boolean cancelTask(UUID taskId) {
        AtomicReference<TaskStatus> previous = new AtomicReference<>();
        registry.update(taskId, t -> {
            if (t.isTerminal()) {
                return t;
            }
            previous.set(t.status());
            return t.withCancelled(clock.instant());
        });

        if (previous.get() == null) {
            log.debug("Cancel ignored for task {}: unknown or already finished", taskId);
            return false;
        }
        metrics.taskTransitioned(previous.get(), TaskStatus.CANCELLED);
        log.warn("Task {} cancelled while {}", taskId, previous.get());
        return true;
    }

    /**
     * Remove finished tasks whose completion is older than the retention window.
     *
     * @return The number of tasks removed
     */
    public int cleanupCompletedTasks() {
        Instant cutoff = clock.instant().minus(RETENTION);
        int removed = 0;
        for (TaskStatus status : TaskStatus.values()) {
            if (!status.isTerminal()) {
                continue;
            }
            int count = registry.removeIf(t -> t.status() == status
                && t.completedAt() != null
                && t.completedAt().isBefore(cutoff));
            metrics.tasksRemoved(status, count);
            removed += count;
        }
        if (removed > 0) {
            log.info("Removed {} finished tasks completed before {}", removed, cutoff);
        }
        return removed;
    }

    // ========== Lifecycle ==========

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Stop accepting submissions and wait for task bodies in flight.
     */
    @Override
    public void close() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down orchestrator, waiting up to {}s for running tasks", SHUTDOWN_TIMEOUT_SECONDS);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                List<Runnable> abandoned = workers.shutdownNow();
                log.warn("Shutdown timeout reached; {} queued tasks abandoned", abandoned.size());
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Orchestrator stopped");
    }

    /**
     * Apply a status change, ignoring it if the task is gone or has already
     * moved past it (for example cancelled while running).
     */
    private void transition(UUID taskId, UnaryOperator<TaskInfo> change) {
        AtomicReference<TaskStatus> from = new AtomicReference<>();
        try {
            Optional<TaskInfo> updated = registry.update(taskId, t -> {
                from.set(t.status());
                return change.apply(t);
            });
            updated.ifPresent(t -> metrics.taskTransitioned(from.get(), t.status()));
        } catch (InvalidStateTransitionException e) {
            log.debug("Ignoring status update for task {}: {}", taskId, e.getMessage());
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
