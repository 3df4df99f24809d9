package com.javacpi.shared.error;

public class ActionNotFoundException extends ActionException {

    private final String actionName;

    public ActionNotFoundException(String actionName) {
        super("Action '" + actionName + "' not found");
        this.actionName = actionName;
    }

    public String actionName() { return actionName; }

    @Override
    public FailureKind kind() {
        return FailureKind.ACTION_NOT_FOUND;
    }
}
