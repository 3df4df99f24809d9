package com.javacpi.schema;

public record ParameterSpec(
    String name,
    String description,
    ParamKind kind,
    boolean required,
    Object defaultValue
) {
    public ParameterSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Parameter '" + name + "' has no kind");
        }
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("Required parameter '" + name + "' cannot declare a default");
        }
        if (!required) {
            var raw = defaultValue;
            defaultValue = kind.coerce(raw).orElseThrow(() -> new IllegalArgumentException(
                    "Optional parameter '" + name + "' needs a " + kind.schemaType() + " default, got: " + raw));
        }
    }

    public static ParameterSpec required(String name, String description, ParamKind kind) {
        return new ParameterSpec(name, description, kind, true, null);
    }

    public static ParameterSpec optional(String name, String description, ParamKind kind, Object defaultValue) {
        return new ParameterSpec(name, description, kind, false, defaultValue);
    }

    public ParameterSpec withDefault(Object newDefault) {
        if (required) {
            throw new IllegalStateException("Required parameter '" + name + "' has no default to override");
        }
        return new ParameterSpec(name, description, kind, false, newDefault);
    }
}
