package com.podmachine.machine;

import com.podmachine.core.metrics.MachineMetrics;
import com.podmachine.machine.kube.ClusterContext;
import com.podmachine.machine.kube.ClusterGateway;
import com.podmachine.machine.kube.WatchSession;
import com.podmachine.machine.kube.WorkloadEventListener;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Waits for a workload to report its pod IP.
 *
 * <p>One watch session per call, bounded by a hard deadline. The first event carrying
 * a non-blank address wins; events without one are skipped. The session is closed on
 * every exit path.
 */
public class AddressWatcher {

    private static final Logger log = LoggerFactory.getLogger(AddressWatcher.class);

    private final ClusterContext cluster;
    private final MachineMetrics metrics;

    public AddressWatcher(ClusterContext cluster, MachineMetrics metrics) {
        this.cluster = cluster;
        this.metrics = metrics;
    }

    /**
     * Blocks until the workload has an address.
     *
     * @return the pod IP, never blank
     * @throws MachineNotFoundException if the workload does not exist, or is deleted while waiting
     * @throws AddressTimeoutException  if no address arrives before the deadline or the stream ends
     * @throws KubernetesClientException if the watch is closed by a backend error, unchanged
     */
    public String awaitAddress(String namespace, String name, Duration timeout) {
        ClusterGateway gateway = cluster.gateway();
        long startMs = System.currentTimeMillis();

        if (gateway.findWorkload(namespace, name).isEmpty()) {
            metrics.recordAddressWait("not_found", System.currentTimeMillis() - startMs);
            throw new MachineNotFoundException(namespace, name);
        }

        var address = new CompletableFuture<String>();
        log.debug("Watching {}/{} for an address (timeout {}s)", namespace, name, timeout.toSeconds());

        try (WatchSession ignored = gateway.watchWorkload(namespace, name, new AddressListener(namespace, name, address))) {
            String ip = address.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            metrics.recordAddressWait("assigned", System.currentTimeMillis() - startMs);
            log.info("Workload {}/{} has address {}", namespace, name, ip);
            return ip;
        } catch (TimeoutException e) {
            metrics.recordAddressWait("timeout", System.currentTimeMillis() - startMs);
            throw new AddressTimeoutException(namespace, name, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MachineException("Interrupted while waiting for the address of " + namespace + "/" + name, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AddressTimeoutException timeoutCause) {
                metrics.recordAddressWait("timeout", System.currentTimeMillis() - startMs);
                throw timeoutCause;
            }
            if (e.getCause() instanceof MachineNotFoundException notFound) {
                metrics.recordAddressWait("not_found", System.currentTimeMillis() - startMs);
                throw notFound;
            }
            metrics.recordAddressWait("error", System.currentTimeMillis() - startMs);
            if (e.getCause() instanceof KubernetesClientException backendFailure) {
                throw backendFailure;
            }
            throw new MachineException("Watch on " + namespace + "/" + name + " failed", e.getCause());
        }
    }

    private static final class AddressListener implements WorkloadEventListener {

        private final String namespace;
        private final String name;
        private final CompletableFuture<String> address;

        AddressListener(String namespace, String name, CompletableFuture<String> address) {
            this.namespace = namespace;
            this.name = name;
            this.address = address;
        }

        @Override
        public void onEvent(EventType type, Pod pod) {
            if (type == EventType.DELETED) {
                address.completeExceptionally(new MachineNotFoundException(namespace, name));
                return;
            }
            if (pod == null || pod.getStatus() == null) {
                return;
            }
            String ip = pod.getStatus().getPodIP();
            if (ip != null && !ip.isBlank()) {
                address.complete(ip);
            }
        }

        /**
         * A plain close is retryable and reported as a timeout; a close caused by a
         * backend error fails with that error.
         */
        @Override
        public void onClose(Exception cause) {
            if (cause != null) {
                address.completeExceptionally(cause);
                return;
            }
            address.completeExceptionally(new AddressTimeoutException(namespace, name, "watch closed"));
        }
    }
}
