package com.opsrunner.engine.executor;

import com.opsrunner.core.exception.StepAttemptException;
import com.opsrunner.core.model.RetryPolicy;
import com.opsrunner.core.model.StepExecution;
import com.opsrunner.core.model.WorkflowExecution;
import com.opsrunner.core.model.WorkflowStep;
import com.opsrunner.engine.config.WorkflowSettings;
import com.opsrunner.engine.logging.LoggingContext;
import com.opsrunner.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Runs a single workflow step: condition gate, then the command under the
 * step's retry policy and timeout.
 *
 * Never throws for command failures. Every outcome, including exhausted
 * retries, is reported as a {@link StepExecution}; the caller decides what a
 * failed step means for the run.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final CommandRunner commandRunner;
    private final ConditionEvaluator conditionEvaluator;
    private final WorkflowSettings settings;
    private final WorkflowMetrics metrics;
    private final Sleeper sleeper;

    public StepExecutor(
            CommandRunner commandRunner,
            ConditionEvaluator conditionEvaluator,
            WorkflowSettings settings,
            WorkflowMetrics metrics) {
        this(commandRunner, conditionEvaluator, settings, metrics, Sleeper.THREAD_SLEEP);
    }

    StepExecutor(
            CommandRunner commandRunner,
            ConditionEvaluator conditionEvaluator,
            WorkflowSettings settings,
            WorkflowMetrics metrics,
            Sleeper sleeper) {
        this.commandRunner = commandRunner;
        this.conditionEvaluator = conditionEvaluator;
        this.settings = settings;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    /**
     * Run one step of the given execution.
     *
     * @param step The step definition
     * @param execution The run the step belongs to; supplies the variables
     * @return SKIPPED, COMPLETED or FAILED outcome
     */
    public StepExecution run(WorkflowStep step, WorkflowExecution execution) {
        Instant startedAt = Instant.now();
        try (var ctx = LoggingContext.forStep(step.id())) {
            StepExecution outcome;
            if (step.isConditional()
                    && !conditionEvaluator.evaluate(step.condition(), execution.variables())) {
                log.info("Skipping step {}: condition '{}' is not true", step.id(), step.condition());
                outcome = StepExecution.skipped(step.id(), startedAt);
            } else {
                outcome = runWithRetries(step, execution, startedAt);
            }
            metrics.stepFinished(outcome.status(), Duration.between(startedAt, outcome.completedAt()));
            return outcome;
        }
    }

    private StepExecution runWithRetries(WorkflowStep step, WorkflowExecution execution, Instant startedAt) {
        RetryPolicy policy = step.effectiveRetryPolicy(settings.defaultRetryPolicy());
        Duration timeout = step.effectiveTimeout(settings.defaultTimeout());
        String lastError;
        int attempt = 0;

        while (true) {
            LoggingContext.setAttempt(attempt);
            try {
                log.debug("Running step {}: {} {}", step.id(), step.command(), step.args());
                CommandResult result = commandRunner.run(
                    step.command(), step.args(), execution.variables(), timeout);
                if (result.succeeded()) {
                    log.info("Step {} completed on attempt {}", step.id(), attempt);
                    return StepExecution.completed(step.id(), startedAt, result.stdout(), attempt);
                }
                lastError = StepAttemptException.nonZeroExit(result.exitCode(), result.stderr()).getMessage();
            } catch (StepAttemptException e) {
                lastError = e.getMessage();
                if (StepAttemptException.INTERRUPTED.equals(e.getErrorCode())) {
                    log.error("Step {} interrupted on attempt {}", step.id(), attempt);
                    return StepExecution.failed(step.id(), startedAt, lastError, attempt);
                }
            } catch (RuntimeException e) {
                lastError = "Unexpected error running '" + step.command() + "': " + e;
                log.error("Step {} attempt {} hit an unexpected error", step.id(), attempt, e);
            }
            log.warn("Step {} attempt {} failed: {}", step.id(), attempt, lastError);

            if (!policy.hasMoreAttempts(attempt)) {
                break;
            }
            attempt++;

            Duration backoff = policy.computeBackoff(attempt);
            log.warn("Retrying step {} in {} ms (retry {}/{})",
                step.id(), backoff.toMillis(), attempt, policy.maxRetries());
            metrics.stepRetried(step.id());
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                String error = StepAttemptException.interrupted(step.command()).getMessage();
                log.error("Step {} interrupted during backoff", step.id());
                return StepExecution.failed(step.id(), startedAt, error, attempt - 1);
            }
        }

        log.error("Step {} failed after {} attempts: {}", step.id(), policy.maxInvocations(), lastError);
        return StepExecution.failed(step.id(), startedAt, lastError, policy.maxRetries());
    }

    /**
     * Waits out the backoff between attempts.
     */
    @FunctionalInterface
    interface Sleeper {
        Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
