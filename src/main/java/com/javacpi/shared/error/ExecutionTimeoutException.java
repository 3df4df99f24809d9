package com.javacpi.shared.error;

public class ExecutionTimeoutException extends ActionException {

    private final long timeoutSeconds;

    public ExecutionTimeoutException(long timeoutSeconds) {
        super("PowerShell command exceeded " + timeoutSeconds + "s and was terminated");
        this.timeoutSeconds = timeoutSeconds;
    }

    public long timeoutSeconds() { return timeoutSeconds; }

    @Override
    public FailureKind kind() {
        return FailureKind.TIMEOUT;
    }
}
