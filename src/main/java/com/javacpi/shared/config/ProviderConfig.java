package com.javacpi.shared.config;

import java.util.Map;

public record ProviderConfig(
    ExecutorConfig executor,
    LookupFailurePolicy lookupFailurePolicy,
    Map<String, Object> defaults
) {
    public ProviderConfig {
        defaults = Map.copyOf(defaults);
    }

    public static ProviderConfig builtIn() {
        return new ProviderConfig(ExecutorConfig.defaults(), LookupFailurePolicy.FAIL, defaultSettings());
    }

    public static Map<String, Object> defaultSettings() {
        return Map.of(
            "memory_mb", 2048L,
            "cpu_count", 2L,
            "generation", 2L,
            "switch_name", "Default Switch"
        );
    }
}
