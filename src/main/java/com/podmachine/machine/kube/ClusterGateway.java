package com.podmachine.machine.kube;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The subset of the Kubernetes API that machine lifecycle operations need.
 * Kept narrow so that the lifecycle logic can run against a simulated cluster in tests.
 *
 * <p>Implementations propagate API failures as fabric8
 * {@code KubernetesClientException}s. A missing object is never an error:
 * lookups return empty instead.
 */
public interface ClusterGateway extends AutoCloseable {

    /**
     * Point lookup of a pod.
     *
     * @return the pod, or empty when it does not exist
     */
    Optional<Pod> findWorkload(String namespace, String name);

    /**
     * Lists pods and secrets in the namespace carrying all of the given labels.
     */
    List<HasMetadata> listOwned(String namespace, Map<String, String> ownerLabels);

    /**
     * Server-side applies the object and returns the state the server stored,
     * including its UID.
     */
    <T extends HasMetadata> T apply(T object);

    /**
     * Deletes the object with background propagation, so that dependents
     * referencing it through owner references are garbage collected.
     * Deleting an object that does not exist is not an error.
     */
    void delete(HasMetadata object);

    /**
     * Blocks until the object no longer exists or the timeout elapses.
     */
    void awaitRemoval(HasMetadata object, Duration timeout);

    /**
     * Opens a watch on the single named pod. Events for the current state of the
     * pod are delivered first, followed by every later change.
     */
    WatchSession watchWorkload(String namespace, String name, WorkloadEventListener listener);

    /**
     * Returns the API server version, used as a reachability probe.
     */
    String serverVersion();

    @Override
    void close();
}
