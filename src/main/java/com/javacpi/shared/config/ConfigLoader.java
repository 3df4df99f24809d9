package com.javacpi.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

public class ConfigLoader {

    public static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".javacpi", "config.yaml"
    );

    public static ProviderConfig load() {
        return load(DEFAULT_PATH);
    }

    public static ProviderConfig load(Path path) {
        return load(path, System.getenv());
    }

    @SuppressWarnings("unchecked")
    static ProviderConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var executor = section(raw, "executor");
        var presence = section(raw, "presence-check");

        var merged = new LinkedHashMap<>(ProviderConfig.defaultSettings());
        section(raw, "defaults").forEach((k, v) -> {
            if (v != null) merged.put(k, v);
        });

        return new ProviderConfig(
            parseExecutorConfig(executor, env),
            LookupFailurePolicy.fromKey(String.valueOf(
                value(presence, "on-lookup-failure", LookupFailurePolicy.FAIL.key()))),
            merged
        );
    }

    private static ExecutorConfig parseExecutorConfig(Map<String, Object> executor, Map<String, String> env) {
        var defaults = ExecutorConfig.defaults();
        var extraEnv = new HashMap<String, String>();
        section(executor, "environment").forEach((k, v) -> extraEnv.put(k, v == null ? "" : String.valueOf(v)));

        return new ExecutorConfig(
            envOrDefault(env, "JAVACPI_POWERSHELL",
                String.valueOf(value(executor, "executable", defaults.executable()))),
            Long.parseLong(envOrDefault(env, "JAVACPI_TIMEOUT",
                String.valueOf(value(executor, "timeout", defaults.timeoutSeconds())))),
            Boolean.parseBoolean(String.valueOf(value(executor, "hide-window", defaults.hideWindow()))),
            Boolean.parseBoolean(String.valueOf(value(executor, "warm-up", defaults.warmUp()))),
            extraEnv
        );
    }

    /** A YAML key with nothing under it loads as null; treat it as an empty section. */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        var value = parent.get(key);
        if (value == null) return Map.of();
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Config section '" + key + "' must be a mapping, got: " + value);
        }
        return (Map<String, Object>) value;
    }

    private static Object value(Map<String, Object> section, String key, Object fallback) {
        var value = section.get(key);
        return value != null ? value : fallback;
    }

    private static String envOrDefault(Map<String, String> env, String name, String fallback) {
        var val = env.get(name);
        return val != null && !val.isBlank() ? val : fallback;
    }
}
