package com.podmachine.machine.kube;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClusterContextTest {

    private final List<InMemoryClusterGateway> gateways = new ArrayList<>();

    private ClusterContext context() {
        return new ClusterContext(() -> {
            var gateway = new InMemoryClusterGateway();
            gateways.add(gateway);
            return new ClusterConnection("ns-" + gateways.size(), "https://k8s.test", gateway);
        });
    }

    @Test
    void resolvesOnFirstUseOnly() {
        var context = context();
        assertTrue(gateways.isEmpty());

        assertEquals("ns-1", context.namespace());
        assertSame(gateways.get(0), context.gateway());
        assertEquals("https://k8s.test", context.masterUrl());
        assertEquals(1, gateways.size());
    }

    @Test
    void reloadReplacesAndClosesTheConnection() {
        var context = context();
        context.namespace();

        context.reload();

        assertEquals("ns-2", context.namespace());
        assertTrue(gateways.get(0).isClosed());
        assertFalse(gateways.get(1).isClosed());
    }

    @Test
    void closeReleasesTheGateway() {
        var context = context();
        context.gateway();

        context.close();

        assertTrue(gateways.get(0).isClosed());
    }

    @Test
    void closeWithoutUseConnectsNothing() {
        context().close();
        assertTrue(gateways.isEmpty());
    }
}
