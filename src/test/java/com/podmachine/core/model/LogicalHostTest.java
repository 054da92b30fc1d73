package com.podmachine.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LogicalHostTest {

    @Test
    void qualifiedName() {
        assertEquals("machines/demo", new LogicalHost("demo", "machines", "img:v1").qualifiedName());
    }

    @Test
    void requiresNameAndNamespace() {
        assertThrows(IllegalArgumentException.class, () -> new LogicalHost(" ", "machines", "img:v1"));
        assertThrows(IllegalArgumentException.class, () -> new LogicalHost("demo", null, "img:v1"));
    }

    @Test
    void machineRecordUserDataFlag() {
        var withUserData = new MachineRecord("demo", "kubernetes", "img", "/tmp/ud", "sles", 22, Instant.now());
        var without = new MachineRecord("demo", "kubernetes", "img", " ", "sles", 22, Instant.now());

        assertTrue(withUserData.hasUserData());
        assertFalse(without.hasUserData());
    }
}
