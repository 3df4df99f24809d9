package com.javacpi.shared.error;

public class ResourceConflictException extends ActionException {

    public ResourceConflictException(String message) {
        super(message);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.RESOURCE_CONFLICT;
    }
}
