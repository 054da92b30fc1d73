package com.podmachine.core.model;

/**
 * Lifecycle state of a logical host as reported to callers.
 *
 * <p>{@link #ABSENT} means the workload does not exist in the cluster. The other
 * states are derived from the pod phase; several pod phases collapse to
 * {@link #STOPPED}.
 */
public enum HostPhase {
    ABSENT,
    STARTING,
    RUNNING,
    STOPPED
}
