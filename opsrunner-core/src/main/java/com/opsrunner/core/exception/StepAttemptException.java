package com.opsrunner.core.exception;

import java.time.Duration;

/**
 * Thrown when a single attempt to run a step's command fails.
 * Recoverable: the step executor retries until its budget is spent.
 */
public class StepAttemptException extends RunnerException {

    public static final String TIMEOUT = "TIMEOUT";
    public static final String NON_ZERO_EXIT = "NON_ZERO_EXIT";
    public static final String LAUNCH_FAILED = "LAUNCH_FAILED";
    public static final String INTERRUPTED = "INTERRUPTED";

    private StepAttemptException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static StepAttemptException timeout(String command, Duration timeout) {
        return new StepAttemptException(TIMEOUT, String.format(
            "Command '%s' timed out after %d seconds", command, timeout.toSeconds()), null);
    }

    public static StepAttemptException nonZeroExit(int exitCode, String stderr) {
        return new StepAttemptException(NON_ZERO_EXIT, String.format(
            "Command failed (exit %d): %s", exitCode, stderr), null);
    }

    public static StepAttemptException launchFailed(String command, Throwable cause) {
        return new StepAttemptException(LAUNCH_FAILED, String.format(
            "Failed to start command '%s': %s", command, cause.getMessage()), cause);
    }

    public static StepAttemptException interrupted(String command) {
        return new StepAttemptException(INTERRUPTED, String.format(
            "Interrupted while running command '%s'", command), null);
    }

    public boolean isTimeout() {
        return TIMEOUT.equals(getErrorCode());
    }
}
