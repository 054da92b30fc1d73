package com.podmachine.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing podmachine-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setMachine(String machine, String namespace) {
        MDC.put("machine", machine);
        MDC.put("namespace", namespace);
    }

    public static void setOperation(String machine, String namespace, String operation) {
        setMachine(machine, namespace);
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("machine");
        MDC.remove("namespace");
        MDC.remove("operation");
    }
}
