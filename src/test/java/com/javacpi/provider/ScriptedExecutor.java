package com.javacpi.provider;

import com.javacpi.exec.ExecutionResult;
import com.javacpi.exec.ToolExecutor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Replays queued results in order and records every script it is asked to run.
 */
class ScriptedExecutor implements ToolExecutor {

    final List<String> scripts = new ArrayList<>();
    private final Deque<Supplier<ExecutionResult>> replies = new ArrayDeque<>();

    ScriptedExecutor reply(String stdout) {
        replies.add(() -> ExecutionResult.success(stdout));
        return this;
    }

    ScriptedExecutor fail(String stderr, int exitCode) {
        replies.add(() -> ExecutionResult.failure(stderr, exitCode));
        return this;
    }

    ScriptedExecutor raise(RuntimeException e) {
        replies.add(() -> { throw e; });
        return this;
    }

    @Override
    public synchronized ExecutionResult execute(String script) {
        scripts.add(script);
        var next = replies.poll();
        if (next == null) {
            throw new AssertionError("Unexpected script: " + script);
        }
        return next.get();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
