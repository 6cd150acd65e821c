package com.snapkeeper.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for the camera worker pool.
 */
@Service
public class SnapkeeperMetrics {

    private final MeterRegistry registry;

    public SnapkeeperMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordWorkerStarted() {
        Counter.builder("snapkeeper.workers.started")
                .register(registry)
                .increment();
    }

    public void recordWorkerRestart() {
        Counter.builder("snapkeeper.workers.restarts")
                .register(registry)
                .increment();
    }

    public void recordWorkerSkipped(String reason) {
        Counter.builder("snapkeeper.workers.skipped")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordWorkerUpdate(boolean applied) {
        Counter.builder("snapkeeper.workers.updates")
                .tag("result", applied ? "applied" : "rejected")
                .register(registry)
                .increment();
    }

    public void registerActiveWorkersGauge(Supplier<Number> activeWorkers) {
        Gauge.builder("snapkeeper.workers.active", activeWorkers)
                .register(registry);
    }
}
