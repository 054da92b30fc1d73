package com.podmachine.machine;

import com.podmachine.core.model.HostPhase;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.Optional;

/**
 * Maps pod status onto the host lifecycle model.
 */
public final class PhaseMapper {

    private PhaseMapper() {}

    /**
     * {@code Pending} is starting, {@code Running} is running; every other phase,
     * including an unknown or missing one, is stopped.
     */
    public static HostPhase map(String podPhase) {
        if (podPhase == null) {
            return HostPhase.STOPPED;
        }
        return switch (podPhase) {
            case "Pending" -> HostPhase.STARTING;
            case "Running" -> HostPhase.RUNNING;
            default -> HostPhase.STOPPED;
        };
    }

    /**
     * Maps the result of a point lookup; an empty lookup is {@link HostPhase#ABSENT}.
     */
    public static HostPhase map(Optional<Pod> workload) {
        return workload
                .map(pod -> map(pod.getStatus() != null ? pod.getStatus().getPhase() : null))
                .orElse(HostPhase.ABSENT);
    }
}
