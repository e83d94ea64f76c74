package com.opsrunner.engine.support;

import com.opsrunner.engine.executor.CommandResult;
import com.opsrunner.engine.executor.CommandRunner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Supplier;

/**
 * CommandRunner that replays scripted outcomes per command instead of
 * launching processes. Commands without a script succeed with empty output.
 */
public class ScriptedCommandRunner implements CommandRunner {

    /**
     * One recorded call.
     */
    public record Invocation(String command, List<String> args, Map<String, String> environment, Duration timeout) {
    }

    private final Map<String, ConcurrentLinkedDeque<Supplier<CommandResult>>> scripts = new HashMap<>();
    private final List<Invocation> invocations = new ArrayList<>();

    public static CommandResult ok(String stdout) {
        return new CommandResult(0, stdout, "");
    }

    public static CommandResult exit(int code, String stderr) {
        return new CommandResult(code, "", stderr);
    }

    /**
     * Queue outcomes for a command; the last one repeats once the queue runs dry.
     */
    public ScriptedCommandRunner script(String command, CommandResult... outcomes) {
        var queue = scripts.computeIfAbsent(command, c -> new ConcurrentLinkedDeque<>());
        for (CommandResult outcome : outcomes) {
            queue.add(() -> outcome);
        }
        return this;
    }

    /**
     * Queue a thrown failure for a command.
     */
    public ScriptedCommandRunner scriptFailure(String command, RuntimeException failure) {
        scripts.computeIfAbsent(command, c -> new ConcurrentLinkedDeque<>()).add(() -> {
            throw failure;
        });
        return this;
    }

    @Override
    public synchronized CommandResult run(String command, List<String> args,
                                          Map<String, String> environment, Duration timeout) {
        invocations.add(new Invocation(command, args, environment, timeout));
        var queue = scripts.get(command);
        if (queue == null || queue.isEmpty()) {
            return ok("");
        }
        Supplier<CommandResult> next = queue.size() > 1 ? queue.poll() : queue.peek();
        return next.get();
    }

    public synchronized List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    public synchronized List<String> invokedCommands() {
        return invocations.stream().map(Invocation::command).toList();
    }

    public synchronized long invocationsOf(String command) {
        return invocations.stream().filter(i -> i.command().equals(command)).count();
    }
}
