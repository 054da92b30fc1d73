package com.podmachine.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HostRuntimeTest {

    @Test
    void startsWithoutAddress() {
        assertTrue(new HostRuntime().address().isEmpty());
    }

    @Test
    void assignAndClear() {
        var runtime = new HostRuntime();
        runtime.assign("10.0.0.5");
        assertEquals("10.0.0.5", runtime.address().orElseThrow());

        runtime.clear();
        assertTrue(runtime.address().isEmpty());
    }

    @Test
    void rejectsBlankAddress() {
        var runtime = new HostRuntime();
        assertThrows(IllegalArgumentException.class, () -> runtime.assign(""));
        assertThrows(IllegalArgumentException.class, () -> runtime.assign(null));
        assertTrue(runtime.address().isEmpty());
    }
}
