package com.javacpi.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed arguments of one invocation after coercion and defaulting. Values are
 * {@code String}, {@code Long} or {@code Boolean}.
 */
public record ValidatedArguments(Map<String, Object> values) {

    public ValidatedArguments {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ValidatedArguments empty() {
        return new ValidatedArguments(Map.of());
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        var value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No argument '" + name + "'");
        }
        return value;
    }

    public String string(String name) {
        return typed(name, String.class);
    }

    public long integer(String name) {
        return typed(name, Long.class);
    }

    public boolean bool(String name) {
        return typed(name, Boolean.class);
    }

    private <T> T typed(String name, Class<T> type) {
        var value = get(name);
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Argument '" + name + "' is not a " + type.getSimpleName());
        }
        return type.cast(value);
    }
}
