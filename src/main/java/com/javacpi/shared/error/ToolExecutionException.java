package com.javacpi.shared.error;

public class ToolExecutionException extends ActionException {

    private final String stderr;
    private final int exitCode;

    public ToolExecutionException(String stderr, int exitCode) {
        super("PowerShell command failed: " + (stderr == null || stderr.isBlank()
                ? "exit code " + exitCode
                : stderr.strip()));
        this.stderr = stderr == null ? "" : stderr;
        this.exitCode = exitCode;
    }

    public String stderr() { return stderr; }

    public int exitCode() { return exitCode; }

    @Override
    public FailureKind kind() {
        return FailureKind.TOOL_EXECUTION_FAILURE;
    }
}
