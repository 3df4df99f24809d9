package com.javacpi.shared.config;

import java.util.Map;

public record ExecutorConfig(
    String executable,
    long timeoutSeconds,
    boolean hideWindow,
    boolean warmUp,
    Map<String, String> environment
) {
    public ExecutorConfig {
        environment = Map.copyOf(environment);
    }

    public static ExecutorConfig defaults() {
        return new ExecutorConfig(defaultExecutable(), 120, true, true, Map.of());
    }

    public static String defaultExecutable() {
        return isWindows() ? "powershell.exe" : "pwsh";
    }

    static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().contains("win");
    }
}
