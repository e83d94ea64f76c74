package com.opsrunner.engine.executor;

import com.opsrunner.core.exception.StepAttemptException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessCommandRunnerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Test
    void capturesStdoutOfSuccessfulCommand() {
        CommandResult result = runner.run("sh", List.of("-c", "echo hello"), Map.of(), TIMEOUT);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.stdout()).isEqualTo("hello\n");
    }

    @Test
    void capturesStderrAndExitCodeOfFailedCommand() {
        CommandResult result = runner.run("sh", List.of("-c", "echo oops >&2; exit 3"), Map.of(), TIMEOUT);

        assertThat(result.succeeded()).isFalse();
        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stderr()).isEqualTo("oops\n");
    }

    @Test
    void addsVariablesToInheritedEnvironment() {
        CommandResult result = runner.run("sh", List.of("-c", "echo \"$GREETING:${PATH:+has-path}\""),
            Map.of("GREETING", "hi"), TIMEOUT);

        assertThat(result.stdout().trim()).isEqualTo("hi:has-path");
    }

    @Test
    void argumentsAreNotShellInterpreted() {
        CommandResult result = runner.run("echo", List.of("$HOME", "a;b"), Map.of(), TIMEOUT);

        assertThat(result.stdout().trim()).isEqualTo("$HOME a;b");
    }

    @Test
    void killsCommandThatExceedsTimeout() {
        long start = System.nanoTime();

        assertThatThrownBy(() -> runner.run("sleep", List.of("30"), Map.of(), Duration.ofMillis(300)))
            .isInstanceOfSatisfying(StepAttemptException.class, e -> assertThat(e.isTimeout()).isTrue());

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void reportsLaunchFailureForMissingProgram() {
        assertThatThrownBy(() -> runner.run("definitely-not-a-real-program-xyz", List.of(), Map.of(), TIMEOUT))
            .isInstanceOfSatisfying(StepAttemptException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(StepAttemptException.LAUNCH_FAILED));
    }

    @Test
    void drainsLargeOutputWithoutBlocking() {
        CommandResult result = runner.run("sh", List.of("-c", "i=0; while [ $i -lt 20000 ]; do echo line-$i; i=$((i+1)); done"),
            Map.of(), TIMEOUT);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.stdout().lines().count()).isEqualTo(20000);
    }

    @Test
    void closedRunnerRefusesNewCommands() {
        runner.close();

        assertThatThrownBy(() -> runner.run("sh", List.of("-c", "echo late"), Map.of(), TIMEOUT))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Command runner is closed");
    }
}
