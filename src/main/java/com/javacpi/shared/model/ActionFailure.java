package com.javacpi.shared.model;

import com.javacpi.shared.error.FailureKind;

public record ActionFailure(FailureKind kind, String message) {}
