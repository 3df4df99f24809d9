package com.javacpi.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the external tool once in the background so later invocations hit warm
 * OS caches. Only the first {@link #runOnce} call does anything; nobody waits for it and
 * its failure has no effect on real invocations.
 */
public class ToolWarmUp {

    private static final Logger log = LoggerFactory.getLogger(ToolWarmUp.class);
    static final String SCRIPT = "Write-Output 'warm'";

    private final AtomicBoolean started = new AtomicBoolean();
    private final CompletableFuture<Boolean> completion = new CompletableFuture<>();

    public boolean runOnce(ToolExecutor executor) {
        if (!started.compareAndSet(false, true)) {
            return false;
        }
        var t = new Thread(() -> completion.complete(warm(executor)), "pwsh-warm-up");
        t.setDaemon(true);
        t.start();
        return true;
    }

    private static boolean warm(ToolExecutor executor) {
        try {
            var ok = executor.execute(SCRIPT).succeeded();
            log.debug("PowerShell warm-up finished, success={}", ok);
            return ok;
        } catch (RuntimeException e) {
            log.debug("PowerShell warm-up failed: {}", e.getMessage());
            return false;
        }
    }

    public boolean started() { return started.get(); }

    /** Completes with {@code true} when the warm-up script succeeded. */
    public CompletableFuture<Boolean> completion() { return completion; }
}
