package com.podmachine.core.health;

import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineException;
import com.podmachine.machine.kube.ClusterContext;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final MachineControllerFactory factory;

    public HealthCheckService(MachineControllerFactory factory) {
        this.factory = factory;
    }

    public List<HealthStatus> checkAll(String kubeconfigToken) {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkCluster(kubeconfigToken));
        return results;
    }

    private HealthStatus checkStore() {
        Path machines = factory.store().machinesDir();
        if (!Files.exists(machines)) {
            return new HealthStatus("store", HealthStatus.Status.DEGRADED,
                    "No machines created yet (" + machines + ")", Map.of());
        }
        if (!Files.isWritable(machines)) {
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Machine store not writable: " + machines, Map.of());
        }
        return new HealthStatus("store", HealthStatus.Status.UP,
                factory.store().list().size() + " machine(s) in " + machines, Map.of());
    }

    private HealthStatus checkCluster(String kubeconfigToken) {
        try (ClusterContext cluster = factory.openCluster(kubeconfigToken)) {
            String version = cluster.gateway().serverVersion();
            return new HealthStatus("cluster", HealthStatus.Status.UP,
                    "Kubernetes " + version + " at " + cluster.masterUrl(),
                    Map.of("namespace", cluster.namespace(), "version", version));
        } catch (MachineException | KubernetesClientException e) {
            log.warn("Cluster health check failed: {}", e.getMessage());
            return new HealthStatus("cluster", HealthStatus.Status.DOWN,
                    "Cluster error: " + e.getMessage(), Map.of());
        }
    }
}
