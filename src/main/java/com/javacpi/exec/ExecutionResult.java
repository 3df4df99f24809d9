package com.javacpi.exec;

public record ExecutionResult(String stdout, String stderr, int exitCode) {

    public ExecutionResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static ExecutionResult success(String stdout) {
        return new ExecutionResult(stdout, "", 0);
    }

    public static ExecutionResult failure(String stderr, int exitCode) {
        return new ExecutionResult("", stderr, exitCode);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
