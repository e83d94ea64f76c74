package com.opsrunner.engine.executor;

import com.opsrunner.core.exception.StepAttemptException;
import com.opsrunner.core.model.ExecutionStatus;
import com.opsrunner.core.model.RetryPolicy;
import com.opsrunner.core.model.StepExecution;
import com.opsrunner.core.model.Workflow;
import com.opsrunner.core.model.WorkflowExecution;
import com.opsrunner.core.model.WorkflowStep;
import com.opsrunner.engine.config.WorkflowSettings;
import com.opsrunner.engine.metrics.WorkflowMetrics;
import com.opsrunner.engine.support.ScriptedCommandRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.opsrunner.engine.support.ScriptedCommandRunner.exit;
import static com.opsrunner.engine.support.ScriptedCommandRunner.ok;
import static org.assertj.core.api.Assertions.*;

class StepExecutorTest {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private ScriptedCommandRunner runner;
    private SimpleMeterRegistry meterRegistry;
    private List<Duration> sleeps;
    private StepExecutor executor;

    @BeforeEach
    void setUp() {
        runner = new ScriptedCommandRunner();
        meterRegistry = new SimpleMeterRegistry();
        sleeps = new ArrayList<>();
        WorkflowSettings settings = new WorkflowSettings(
            Path.of("workflows"), 4, DEFAULT_TIMEOUT, RetryPolicy.defaultPolicy());
        executor = new StepExecutor(runner, new ConditionEvaluator(), settings,
            new WorkflowMetrics(meterRegistry), sleeps::add);
    }

    private static WorkflowExecution executionWith(Map<String, String> variables) {
        return WorkflowExecution.create(Workflow.builder().name("test").variables(variables).build());
    }

    @Test
    @DisplayName("Successful first attempt completes with retry count 0 and captured stdout")
    void firstAttemptSucceeds() {
        runner.script("echo", ok("hello\n"));
        WorkflowStep step = WorkflowStep.builder().id("greet").command("echo", "hello").build();

        StepExecution result = executor.run(step, executionWith(Map.of()));

        assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(result.output()).isEqualTo("hello\n");
        assertThat(result.retryCount()).isZero();
        assertThat(result.errorMessage()).isNull();
        assertThat(result.completedAt()).isNotNull();
        assertThat(sleeps).isEmpty();
        assertThat(runner.invocations().get(0).args()).containsExactly("hello");
    }

    @Test
    @DisplayName("Always-failing step is invoked max+1 times and ends FAILED with retry count max")
    void retryExhaustion() {
        runner.script("flaky", exit(1, "boom"));
        WorkflowStep step = WorkflowStep.builder().id("s").command("flaky").retryCount(2).build();

        StepExecution result = executor.run(step, executionWith(Map.of()));

        assertThat(runner.invocationsOf("flaky")).isEqualTo(3);
        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.retryCount()).isEqualTo(2);
        assertThat(result.errorMessage()).contains("boom");
        assertThat(result.output()).isNull();
    }

    @Test
    @DisplayName("Step that recovers on the second attempt reports retry count 1 and that attempt's output")
    void retryRecovery() {
        runner.script("flaky", exit(1, "first try"), ok("second try"));
        WorkflowStep step = WorkflowStep.builder().id("s").command("flaky").retryCount(2).build();

        StepExecution result = executor.run(step, executionWith(Map.of()));

        assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(result.retryCount()).isEqualTo(1);
        assertThat(result.output()).isEqualTo("second try");
        assertThat(runner.invocationsOf("flaky")).isEqualTo(2);
    }

    @Test
    @DisplayName("Backoff before retry n is 2^n units")
    void exponentialBackoff() {
        runner.script("fail", exit(2, "nope"));
        WorkflowStep step = WorkflowStep.builder().id("s").command("fail").retryCount(3).build();

        executor.run(step, executionWith(Map.of()));

        assertThat(sleeps).containsExactly(
            Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8));
    }

    @Test
    @DisplayName("Workflow default retry budget applies when the step sets none")
    void defaultRetryBudget() {
        runner.script("fail", exit(1, "x"));
        WorkflowStep step = WorkflowStep.builder().id("s").command("fail").build();

        StepExecution result = executor.run(step, executionWith(Map.of()));

        assertThat(runner.invocationsOf("fail")).isEqualTo(4);
        assertThat(result.retryCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Zero retry budget means a single attempt")
    void noRetry() {
        runner.script("fail", exit(1, "x"));
        WorkflowStep step = WorkflowStep.builder().id("s").command("fail").retryCount(0).build();

        StepExecution result = executor.run(step, executionWith(Map.of()));

        assertThat(runner.invocationsOf("fail")).isEqualTo(1);
        assertThat(result.retryCount()).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Timeout is a retryable attempt failure")
    void timeoutIsRetried() {
        runner.scriptFailure("slow", StepAttemptException.timeout("slow", Duration.ofSeconds(1)))
            .script("slow", ok("done"));
        WorkflowStep step = WorkflowStep.builder().id("s").command("slow").timeout(1L).retryCount(1).build();

        StepExecution result = executor.run(step, executionWith(Map.of()));

        assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(result.retryCount()).isEqualTo(1);
        assertThat(runner.invocations()).allSatisfy(i -> assertThat(i.timeout()).isEqualTo(Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("Last timeout message is reported when every attempt times out")
    void timeoutExhaustion() {
        runner.scriptFailure("slow", StepAttemptException.timeout("slow", Duration.ofSeconds(1)));
        WorkflowStep step = WorkflowStep.builder().id("s").command("slow").retryCount(0).build();

        StepExecution result = executor.run(step, executionWith(Map.of()));

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.errorMessage()).contains("timed out");
    }

    @Test
    @DisplayName("False condition skips the step without invoking its command")
    void conditionSkip() {
        WorkflowStep step = WorkflowStep.builder().id("s").command("deploy").condition("$flag").build();

        StepExecution result = executor.run(step, executionWith(Map.of("flag", "false")));

        assertThat(result.status()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(result.retryCount()).isZero();
        assertThat(result.output()).isNull();
        assertThat(runner.invocations()).isEmpty();
    }

    @Test
    @DisplayName("True condition runs the step normally")
    void conditionPass() {
        runner.script("deploy", ok("deployed"));
        WorkflowStep step = WorkflowStep.builder().id("s").command("deploy").condition("$flag").build();

        StepExecution result = executor.run(step, executionWith(Map.of("flag", "true")));

        assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(runner.invocationsOf("deploy")).isEqualTo(1);
    }

    @Test
    @DisplayName("Run variables are handed to the command as its environment")
    void variablesBecomeEnvironment() {
        WorkflowStep step = WorkflowStep.builder().id("s").command("env").build();

        executor.run(step, executionWith(Map.of("TARGET", "prod")));

        assertThat(runner.invocations().get(0).environment()).containsEntry("TARGET", "prod");
        assertThat(runner.invocations().get(0).timeout()).isEqualTo(DEFAULT_TIMEOUT);
    }

    @Test
    @DisplayName("Unexpected runner error counts as a failed attempt and is retried")
    void unexpectedRunnerErrorIsRetried() {
        runner.scriptFailure("flaky", new IllegalStateException("pipe broke"))
            .script("flaky", ok("done"));
        WorkflowStep step = WorkflowStep.builder().id("s").command("flaky").retryCount(1).build();

        StepExecution result = executor.run(step, executionWith(Map.of()));

        assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(result.retryCount()).isEqualTo(1);
        assertThat(runner.invocationsOf("flaky")).isEqualTo(2);
    }

    @Test
    @DisplayName("Unexpected runner error on the last attempt fails the step with its message")
    void unexpectedRunnerErrorExhaustsRetries() {
        runner.scriptFailure("broken", new IllegalStateException("pipe broke"));
        WorkflowStep step = WorkflowStep.builder().id("s").command("broken").retryCount(0).build();

        StepExecution result = executor.run(step, executionWith(Map.of()));

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.errorMessage()).contains("pipe broke");
    }

    @Test
    @DisplayName("Step outcomes and retries are counted")
    void metricsRecorded() {
        runner.script("flaky", exit(1, "x"), ok("y"));
        WorkflowStep step = WorkflowStep.builder().id("s").command("flaky").retryCount(1).build();

        executor.run(step, executionWith(Map.of()));

        assertThat(meterRegistry.get(WorkflowMetrics.STEP_RETRIES).counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get(WorkflowMetrics.STEP_OUTCOMES).tag("status", "COMPLETED").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Interrupt during backoff fails the step without further attempts")
    void interruptedBackoff() {
        runner.script("fail", exit(1, "x"));
        WorkflowSettings settings = new WorkflowSettings(
            Path.of("workflows"), 1, DEFAULT_TIMEOUT, RetryPolicy.defaultPolicy());
        StepExecutor interrupting = new StepExecutor(runner, new ConditionEvaluator(), settings,
            new WorkflowMetrics(meterRegistry), d -> {
                throw new InterruptedException();
            });
        WorkflowStep step = WorkflowStep.builder().id("s").command("fail").retryCount(3).build();

        try {
            StepExecution result = interrupting.run(step, executionWith(Map.of()));

            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.retryCount()).isZero();
            assertThat(runner.invocationsOf("fail")).isEqualTo(1);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
