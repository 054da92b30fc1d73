package com.podmachine.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MachineMetricsTest {

    private SimpleMeterRegistry registry;
    private MachineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MachineMetrics(registry);
    }

    @Test
    void recordOperationSuccess() {
        metrics.recordOperation("start", true);
        metrics.recordOperation("start", true);

        var counter = registry.find("podmachine.lifecycle.operations")
                .tag("operation", "start").tag("outcome", "success").counter();
        assertNotNull(counter);
        assertEquals(2.0, counter.count());
    }

    @Test
    void recordOperationFailureIsSeparate() {
        metrics.recordOperation("stop", true);
        metrics.recordOperation("stop", false);

        var failures = registry.find("podmachine.lifecycle.operations")
                .tag("operation", "stop").tag("outcome", "failure").counter();
        assertNotNull(failures);
        assertEquals(1.0, failures.count());
    }

    @Test
    void recordAddressWait() {
        metrics.recordAddressWait("assigned", 1500);

        var timer = registry.find("podmachine.address.wait").tag("outcome", "assigned").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.1);
    }
}
