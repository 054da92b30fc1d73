package com.podmachine.core.model;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable runtime status of a logical host, kept apart from its identity.
 *
 * <p>The address is only assigned after the workload reported one and is cleared
 * whenever the backend objects are torn down.
 */
public class HostRuntime {

    private final AtomicReference<String> assignedAddress = new AtomicReference<>();

    public void assign(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Assigned address must not be blank");
        }
        assignedAddress.set(address);
    }

    public void clear() {
        assignedAddress.set(null);
    }

    public Optional<String> address() {
        return Optional.ofNullable(assignedAddress.get());
    }
}
