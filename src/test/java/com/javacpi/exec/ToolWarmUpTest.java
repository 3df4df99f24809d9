package com.javacpi.exec;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ToolWarmUpTest {

    private static ToolExecutor counting(AtomicInteger calls) {
        return new ToolExecutor() {
            @Override
            public ExecutionResult execute(String script) {
                calls.incrementAndGet();
                assertEquals(ToolWarmUp.SCRIPT, script);
                return ExecutionResult.success("warm");
            }

            @Override
            public boolean isAvailable() {
                return true;
            }
        };
    }

    @Test
    void concurrentTriggersRunOnce() throws Exception {
        var calls = new AtomicInteger();
        var executor = counting(calls);
        var warmUp = new ToolWarmUp();
        var winners = new AtomicInteger();
        var go = new CountDownLatch(1);
        var threads = new ArrayList<Thread>();

        for (int i = 0; i < 8; i++) {
            var t = new Thread(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (warmUp.runOnce(executor)) winners.incrementAndGet();
            });
            threads.add(t);
            t.start();
        }
        go.countDown();
        for (var t : threads) t.join(5000);

        assertTrue(warmUp.completion().get(5, TimeUnit.SECONDS));
        assertEquals(1, winners.get());
        assertEquals(1, calls.get());
        assertTrue(warmUp.started());
    }

    @Test
    void failureDoesNotPropagate() throws Exception {
        var warmUp = new ToolWarmUp();
        var executor = new ToolExecutor() {
            @Override
            public ExecutionResult execute(String script) {
                throw new IllegalStateException("no pwsh here");
            }

            @Override
            public boolean isAvailable() {
                return false;
            }
        };

        assertTrue(warmUp.runOnce(executor));
        assertFalse(warmUp.completion().get(5, TimeUnit.SECONDS));
        assertFalse(warmUp.runOnce(executor));
    }
}
