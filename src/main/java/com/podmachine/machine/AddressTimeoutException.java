package com.podmachine.machine;

import java.time.Duration;

/**
 * Thrown when a workload did not report a network address before the deadline,
 * or the watch stream ended first. Callers may retry.
 */
public class AddressTimeoutException extends MachineException {

    private final Duration timeout;

    public AddressTimeoutException(String namespace, String name, Duration timeout) {
        super("Failed to get IP of " + namespace + "/" + name + " within " + timeout.toSeconds() + "s");
        this.timeout = timeout;
    }

    public AddressTimeoutException(String namespace, String name, String reason) {
        super("Failed to get IP of " + namespace + "/" + name + ": " + reason);
        this.timeout = null;
    }

    /** The deadline that elapsed, or {@code null} when the watch stream closed early. */
    public Duration getTimeout() {
        return timeout;
    }
}
