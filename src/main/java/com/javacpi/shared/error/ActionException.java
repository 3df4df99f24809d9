package com.javacpi.shared.error;

/**
 * Base of every failure raised by a dispatch stage. The dispatcher converts these
 * into failed {@link com.javacpi.shared.model.ActionResult}s; they never reach the caller.
 */
public abstract class ActionException extends RuntimeException {

    protected ActionException(String message) {
        super(message);
    }

    protected ActionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind kind();
}
