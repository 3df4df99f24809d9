package com.javacpi.observability;

import com.javacpi.shared.error.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig() {
        this(new SimpleMeterRegistry());
    }

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Timer actionLatency(String action) {
        return Timer.builder("javacpi.action.latency").tag("action", action).register(registry);
    }

    public Counter actionCalls() {
        return Counter.builder("javacpi.action.calls").register(registry);
    }

    public Counter actionFailures(FailureKind kind) {
        return Counter.builder("javacpi.action.failures").tag("kind", kind.name()).register(registry);
    }

    public Counter toolInvocations() {
        return Counter.builder("javacpi.tool.invocations").register(registry);
    }
}
