package com.opsrunner.engine.orchestrator;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * A submitted task: its registry id and the eventual result of its body.
 */
public record TaskHandle<T>(UUID taskId, CompletableFuture<T> result) {

    /**
     * Wait for the task body and return its result.
     * A failure of the body is rethrown as the body threw it.
     */
    public T await() {
        try {
            return result.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
