package com.javacpi.shared.error;

public class SpawnFailureException extends ActionException {

    public SpawnFailureException(String executable, Throwable cause) {
        super("Failed to start '" + executable + "': " + cause.getMessage(), cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.SPAWN_FAILURE;
    }
}
