package com.javacpi.shared.error;

public enum FailureKind {
    ACTION_NOT_FOUND,
    MISSING_REQUIRED_PARAMETER,
    TYPE_MISMATCH,
    SPAWN_FAILURE,
    TOOL_EXECUTION_FAILURE,
    MALFORMED_OUTPUT,
    TIMEOUT,
    RESOURCE_CONFLICT,
    INTERNAL_ERROR
}
