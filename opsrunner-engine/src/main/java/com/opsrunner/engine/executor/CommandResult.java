package com.opsrunner.engine.executor;

/**
 * Captured outcome of one finished command invocation.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
