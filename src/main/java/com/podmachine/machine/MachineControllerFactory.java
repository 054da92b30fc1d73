package com.podmachine.machine;

import com.podmachine.core.metrics.MachineMetrics;
import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.kube.ClusterConnectionResolver;
import com.podmachine.machine.kube.ClusterContext;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Creates machine records and the controllers that operate on them.
 */
@Service
public class MachineControllerFactory {

    private final MachineProperties properties;
    private final MachineStore store;
    private final SshKeyGenerator keyGenerator;
    private final ClusterConnectionResolver resolver;
    private final MachineMetrics metrics;

    public MachineControllerFactory(MachineProperties properties,
                                    MachineStore store,
                                    SshKeyGenerator keyGenerator,
                                    ClusterConnectionResolver resolver,
                                    MachineMetrics metrics) {
        this.properties = properties;
        this.store = store;
        this.keyGenerator = keyGenerator;
        this.resolver = resolver;
        this.metrics = metrics;
    }

    /**
     * Builds the record for a new machine; blank arguments fall back to configuration.
     */
    public MachineRecord newRecord(String name, String image, String userDataPath) {
        MachineStore.validateName(name);
        String userData = userDataPath != null && !userDataPath.isBlank()
                ? Path.of(userDataPath).toAbsolutePath().toString()
                : blankToNull(properties.getUserData());
        return new MachineRecord(
                name,
                properties.getDriverName(),
                properties.resolveImage(image),
                userData,
                properties.getSshUser(),
                properties.getSshPort(),
                Instant.now());
    }

    /**
     * Opens a lazily resolved cluster context.
     *
     * @param kubeconfigToken base64 kubeconfig overriding {@code podmachine.cluster.kubeconfig-token}; may be blank
     */
    public ClusterContext openCluster(String kubeconfigToken) {
        String token = kubeconfigToken != null && !kubeconfigToken.isBlank()
                ? kubeconfigToken
                : properties.getKubeconfigToken();
        return new ClusterContext(() -> resolver.resolve(token));
    }

    public MachineLifecycleController controllerFor(MachineRecord record, ClusterContext cluster) {
        return new MachineLifecycleController(
                record,
                cluster,
                MachineObjectBuilder.fromProperties(properties),
                new ObjectSetApplier(cluster, properties.getDeleteTimeout()),
                new AddressWatcher(cluster, metrics),
                keyGenerator,
                store,
                properties,
                metrics);
    }

    public MachineStore store() {
        return store;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
