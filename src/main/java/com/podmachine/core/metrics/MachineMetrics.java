package com.podmachine.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for machine lifecycle operations.
 */
@Service
public class MachineMetrics {

    private final MeterRegistry registry;

    public MachineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, boolean succeeded) {
        Counter.builder("podmachine.lifecycle.operations")
                .tag("operation", operation)
                .tag("outcome", succeeded ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Records how long a caller waited for a workload address.
     *
     * @param outcome "assigned", "timeout", "not_found" or "error"
     */
    public void recordAddressWait(String outcome, long ms) {
        Timer.builder("podmachine.address.wait")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
