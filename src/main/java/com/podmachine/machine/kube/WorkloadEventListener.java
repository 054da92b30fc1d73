package com.podmachine.machine.kube;

import io.fabric8.kubernetes.api.model.Pod;

/**
 * Receives status events for a single watched workload.
 */
public interface WorkloadEventListener {

    enum EventType { ADDED, MODIFIED, DELETED, BOOKMARK, ERROR }

    void onEvent(EventType type, Pod pod);

    /**
     * Called once when the event stream ends without being closed by the subscriber.
     *
     * @param cause the failure that ended the stream, or {@code null} for a normal close
     */
    void onClose(Exception cause);
}
