package com.javacpi.shared.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.javacpi.shared.error.FailureKind;

/**
 * Outcome of one action invocation: either a structured payload or a tagged failure.
 */
public record ActionResult(ObjectNode payload, ActionFailure failure) {

    public ActionResult {
        if ((payload == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of payload or failure must be set");
        }
    }

    public static ActionResult ok(ObjectNode payload) {
        return new ActionResult(payload, null);
    }

    public static ActionResult failure(FailureKind kind, String message) {
        return new ActionResult(null, new ActionFailure(kind, message));
    }

    public boolean isError() {
        return failure != null;
    }
}
