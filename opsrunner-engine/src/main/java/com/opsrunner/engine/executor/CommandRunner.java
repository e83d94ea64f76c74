package com.opsrunner.engine.executor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs one external command to completion.
 */
public interface CommandRunner {

    /**
     * Run a command and wait for it to finish.
     *
     * @param command Program to launch
     * @param args Arguments passed verbatim, no shell interpretation
     * @param environment Variables added to the inherited environment of the child
     * @param timeout Upper bound on the wait; the child is killed when it is exceeded
     * @return The exit code and captured output of a command that finished in time
     * @throws com.opsrunner.core.exception.StepAttemptException on timeout, launch failure or interruption
     */
    CommandResult run(String command, List<String> args, Map<String, String> environment, Duration timeout);
}
