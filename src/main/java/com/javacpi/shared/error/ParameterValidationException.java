package com.javacpi.shared.error;

public class ParameterValidationException extends ActionException {

    private final FailureKind kind;
    private final String parameter;

    private ParameterValidationException(FailureKind kind, String parameter, String message) {
        super(message);
        this.kind = kind;
        this.parameter = parameter;
    }

    public static ParameterValidationException missing(String action, String parameter) {
        return new ParameterValidationException(FailureKind.MISSING_REQUIRED_PARAMETER, parameter,
                "Missing required parameter '" + parameter + "' for action '" + action + "'");
    }

    public static ParameterValidationException typeMismatch(String action, String parameter,
                                                            String expected, Object actual) {
        var actualType = actual == null ? "null" : actual.getClass().getSimpleName();
        return new ParameterValidationException(FailureKind.TYPE_MISMATCH, parameter,
                "Parameter '" + parameter + "' of action '" + action + "' expects " + expected
                        + " but got " + actualType + " '" + actual + "'");
    }

    public static ParameterValidationException notAnObject(String action, String actualType) {
        return new ParameterValidationException(FailureKind.TYPE_MISMATCH, null,
                "Parameters of action '" + action + "' must be a JSON object, got " + actualType);
    }

    public String parameter() { return parameter; }

    @Override
    public FailureKind kind() {
        return kind;
    }
}
