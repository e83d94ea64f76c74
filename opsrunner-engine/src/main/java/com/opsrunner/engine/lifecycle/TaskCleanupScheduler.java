package com.opsrunner.engine.lifecycle;

import com.opsrunner.engine.orchestrator.TaskOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically sweeps finished tasks out of the orchestrator's registry.
 * Single use: once stopped it cannot be started again.
 */
public class TaskCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskCleanupScheduler.class);

    private final TaskOrchestrator orchestrator;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public TaskCleanupScheduler(TaskOrchestrator orchestrator, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("cleanup interval must be > 0");
        }
        this.orchestrator = orchestrator;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "opsrunner-task-cleanup");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start the periodic sweep.
     *
     * @throws IllegalStateException if the scheduler has already been stopped
     */
    public synchronized void start() {
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("Task cleanup scheduler has been stopped and cannot be restarted");
        }
        if (running) {
            log.warn("Task cleanup scheduler already running");
            return;
        }
        running = true;
        scheduler.scheduleWithFixedDelay(
            this::sweep,
            interval.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        log.info("Task cleanup scheduler started (every {})", interval);
    }

    /**
     * Stop the scheduler.
     */
    public synchronized void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Task cleanup scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    void sweep() {
        if (!running) return;

        try {
            int removed = orchestrator.cleanupCompletedTasks();
            log.debug("Cleanup sweep removed {} tasks", removed);
        } catch (RuntimeException e) {
            // Keep the schedule alive; a thrown exception would cancel it
            log.error("Task cleanup sweep failed", e);
        }
    }
}
