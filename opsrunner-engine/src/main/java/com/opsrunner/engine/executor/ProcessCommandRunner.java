package com.opsrunner.engine.executor;

import com.opsrunner.core.exception.StepAttemptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * stdout and stderr are drained on separate threads while the caller waits,
 * so a chatty child cannot block on a full pipe.
 */
public class ProcessCommandRunner implements CommandRunner, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final AtomicInteger readerCount = new AtomicInteger();
    private final ExecutorService streamReaders = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "opsrunner-stream-reader-" + readerCount.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    @Override
    public CommandResult run(String command, List<String> args, Map<String, String> environment, Duration timeout) {
        if (streamReaders.isShutdown()) {
            throw new IllegalStateException("Command runner is closed");
        }
        List<String> commandLine = new ArrayList<>();
        commandLine.add(command);
        commandLine.addAll(args);

        ProcessBuilder builder = new ProcessBuilder(commandLine);
        builder.environment().putAll(environment);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw StepAttemptException.launchFailed(command, e);
        }
        log.debug("Started pid {}: {}", process.pid(), commandLine);

        // stdin is unused; close it so programs reading it see EOF
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                kill(process);
                throw StepAttemptException.timeout(command, timeout);
            }
            return new CommandResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw StepAttemptException.interrupted(command);
        } catch (ExecutionException e) {
            throw StepAttemptException.launchFailed(command, e.getCause());
        }
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamReaders);
    }

    private void kill(Process process) {
        process.destroyForcibly();
        try {
            // Reap so no zombie outlives the attempt
            process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Killed pid {}", process.pid());
    }

    /**
     * Release the stream reader threads. Output of commands still running is
     * drained by threads already started.
     */
    @Override
    public void close() {
        streamReaders.shutdown();
        log.debug("Command runner closed");
    }
}
