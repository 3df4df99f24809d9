package com.javacpi.exec;

/**
 * Runs one script in the external management tool. Each call spawns exactly one
 * process and blocks until it exits.
 *
 * <p>Implementations throw {@link com.javacpi.shared.error.SpawnFailureException} when the
 * process cannot be started and {@link com.javacpi.shared.error.ExecutionTimeoutException}
 * when it outlives the configured wait. A non-zero exit is not an exception: it is
 * reported through {@link ExecutionResult#exitCode()}.
 */
public interface ToolExecutor {

    ExecutionResult execute(String script);

    boolean isAvailable();
}
