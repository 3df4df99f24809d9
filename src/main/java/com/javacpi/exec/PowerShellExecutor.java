package com.javacpi.exec;

import com.javacpi.shared.config.ExecutorConfig;
import com.javacpi.shared.error.ExecutionTimeoutException;
import com.javacpi.shared.error.SpawnFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs scripts through {@code powershell.exe}/{@code pwsh} under a fixed, non-interactive
 * invocation policy. The script travels as {@code -EncodedCommand} so no quoting of the
 * OS command line can alter it.
 */
public class PowerShellExecutor implements ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(PowerShellExecutor.class);
    private static final long DRAIN_JOIN_MS = 5000;

    private final ExecutorConfig config;
    private final ProcessEnvironment environment;

    public PowerShellExecutor(ExecutorConfig config) {
        this(config, ProcessEnvironment.system(config.environment()));
    }

    public PowerShellExecutor(ExecutorConfig config, ProcessEnvironment environment) {
        this.config = config;
        this.environment = environment;
    }

    @Override
    public ExecutionResult execute(String script) {
        log.debug("Running PowerShell script: {}", script);
        var proc = start(commandLine(script));
        var stdout = new ByteArrayOutputStream();
        var stderr = new ByteArrayOutputStream();
        var outReader = drain(proc.getInputStream(), stdout, "pwsh-stdout");
        var errReader = drain(proc.getErrorStream(), stderr, "pwsh-stderr");
        closeStdin(proc);
        try {
            if (!proc.waitFor(config.timeoutSeconds(), TimeUnit.SECONDS)) {
                proc.destroyForcibly();
                outReader.join(DRAIN_JOIN_MS);
                errReader.join(DRAIN_JOIN_MS);
                throw new ExecutionTimeoutException(config.timeoutSeconds());
            }
            outReader.join(DRAIN_JOIN_MS);
            errReader.join(DRAIN_JOIN_MS);
        } catch (InterruptedException e) {
            proc.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for PowerShell", e);
        }
        var result = new ExecutionResult(
                stdout.toString(StandardCharsets.UTF_8),
                stderr.toString(StandardCharsets.UTF_8),
                proc.exitValue());
        if (!result.succeeded()) {
            log.debug("PowerShell exited with {}: {}", result.exitCode(), result.stderr().strip());
        } else if (!result.stderr().isBlank()) {
            log.debug("PowerShell wrote to stderr on success: {}", result.stderr().strip());
        }
        return result;
    }

    /**
     * Full argument vector for {@code script}, wrapper included.
     */
    public List<String> commandLine(String script) {
        var cmd = new ArrayList<String>();
        cmd.add(config.executable());
        cmd.add("-NoLogo");
        cmd.add("-NoProfile");
        cmd.add("-NonInteractive");
        cmd.add("-ExecutionPolicy");
        cmd.add("Bypass");
        if (environment.windows() && config.hideWindow()) {
            cmd.add("-WindowStyle");
            cmd.add("Hidden");
        }
        cmd.add("-EncodedCommand");
        cmd.add(encode(wrap(script)));
        return cmd;
    }

    static String wrap(String script) {
        return "& { [Console]::OutputEncoding = [System.Text.Encoding]::UTF8; "
                + "$ProgressPreference = 'SilentlyContinue'; "
                + "$ErrorActionPreference = 'Stop'; "
                + script + " }";
    }

    static String encode(String command) {
        return Base64.getEncoder().encodeToString(command.getBytes(StandardCharsets.UTF_16LE));
    }

    private Process start(List<String> cmd) {
        var pb = new ProcessBuilder(cmd);
        pb.environment().clear();
        pb.environment().putAll(environment.sanitized());
        try {
            return pb.start();
        } catch (IOException e) {
            throw new SpawnFailureException(config.executable(), e);
        }
    }

    private static void closeStdin(Process proc) {
        try {
            proc.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close PowerShell stdin: {}", e.getMessage());
        }
    }

    private static Thread drain(InputStream in, OutputStream sink, String name) {
        var t = new Thread(() -> {
            try (in) {
                in.transferTo(sink);
            } catch (IOException e) {
                log.debug("Stream {} closed early: {}", name, e.getMessage());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    @Override
    public boolean isAvailable() {
        try {
            var proc = new ProcessBuilder(config.executable(), "-NoLogo", "-NoProfile", "-NonInteractive",
                    "-Command", "exit 0")
                    .redirectErrorStream(true).start();
            var reader = drain(proc.getInputStream(), OutputStream.nullOutputStream(), "pwsh-probe");
            var done = proc.waitFor(30, TimeUnit.SECONDS);
            if (!done) proc.destroyForcibly();
            reader.join(2000);
            return done && proc.exitValue() == 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.debug("PowerShell not available: {}", e.getMessage());
            return false;
        }
    }

    public ExecutorConfig config() { return config; }
}
