package com.javacpi.exec;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the environment handed to the tool process: an allowlist of the parent's
 * variables plus configured extras.
 */
public class ProcessEnvironment {

    private static final Set<String> UNIX_ENV = Set.of(
            "PATH", "HOME", "TERM", "LANG", "USER", "SHELL", "TMPDIR", "PSMODULEPATH");
    private static final Set<String> WIN_ENV = Set.of(
            "PATH", "PATHEXT", "SYSTEMROOT", "SYSTEMDRIVE", "WINDIR", "COMSPEC", "TEMP", "TMP",
            "USERPROFILE", "USERNAME", "USERDOMAIN", "HOMEDRIVE", "HOMEPATH", "APPDATA", "LOCALAPPDATA",
            "PROGRAMFILES", "PROGRAMDATA", "PSMODULEPATH", "COMPUTERNAME",
            "PROCESSOR_ARCHITECTURE", "NUMBER_OF_PROCESSORS");

    private final Map<String, String> source;
    private final boolean windows;
    private final Map<String, String> extra;

    public ProcessEnvironment(Map<String, String> source, boolean windows, Map<String, String> extra) {
        this.source = source;
        this.windows = windows;
        this.extra = Map.copyOf(extra);
    }

    public static ProcessEnvironment system(Map<String, String> extra) {
        return new ProcessEnvironment(System.getenv(), isWindows(), extra);
    }

    public Map<String, String> sanitized() {
        var allowed = windows ? WIN_ENV : UNIX_ENV;
        var env = new HashMap<String, String>();
        // Windows variable names are case-insensitive ("Path" vs "PATH")
        source.forEach((k, v) -> {
            if (allowed.contains(k.toUpperCase(Locale.ROOT))) env.put(k, v);
        });
        env.putAll(extra);
        return env;
    }

    public boolean windows() { return windows; }

    static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}
