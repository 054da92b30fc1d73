package com.podmachine.machine;

import com.podmachine.core.logging.MdcContext;
import com.podmachine.core.metrics.MachineMetrics;
import com.podmachine.core.model.HostPhase;
import com.podmachine.core.model.HostRuntime;
import com.podmachine.core.model.LogicalHost;
import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.kube.ClusterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Drives one machine through its lifecycle.
 *
 * <p>Flow for {@link #start()}: stop -> build objects -> apply -> wait for the pod IP.
 * Starting always tears down first, so a half-applied earlier attempt is repaired and
 * repeated starts converge on the same objects.
 *
 * <p>Not thread-safe: callers run at most one operation per machine at a time.
 * Controllers for different machines are independent.
 */
public class MachineLifecycleController {

    private static final Logger log = LoggerFactory.getLogger(MachineLifecycleController.class);

    private final MachineRecord record;
    private final ClusterContext cluster;
    private final MachineObjectBuilder objectBuilder;
    private final ObjectSetApplier applier;
    private final AddressWatcher addressWatcher;
    private final SshKeyGenerator keyGenerator;
    private final MachineStore store;
    private final MachineProperties properties;
    private final MachineMetrics metrics;
    private final HostRuntime runtime = new HostRuntime();

    public MachineLifecycleController(MachineRecord record,
                                      ClusterContext cluster,
                                      MachineObjectBuilder objectBuilder,
                                      ObjectSetApplier applier,
                                      AddressWatcher addressWatcher,
                                      SshKeyGenerator keyGenerator,
                                      MachineStore store,
                                      MachineProperties properties,
                                      MachineMetrics metrics) {
        this.record = record;
        this.cluster = cluster;
        this.objectBuilder = objectBuilder;
        this.applier = applier;
        this.addressWatcher = addressWatcher;
        this.keyGenerator = keyGenerator;
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
    }

    public String getMachineName() {
        return record.name();
    }

    public String getDriverName() {
        return record.driverName();
    }

    /**
     * Identity of the machine in the currently resolved namespace.
     */
    public LogicalHost host() {
        return new LogicalHost(record.name(), cluster.namespace(), properties.resolveImage(record.image()));
    }

    /**
     * Fails early when a configured user-data file cannot be read.
     */
    public void preCreateCheck() {
        if (record.hasUserData()) {
            Path userData = Path.of(record.userDataPath());
            if (!Files.isReadable(userData)) {
                throw new MachineConfigurationException("Cannot read userdata file " + userData);
            }
        }
    }

    /**
     * Generates the machine's SSH keypair. Nothing is created in the cluster.
     */
    public void create() {
        log.info("Generating SSH key for machine {}", record.name());
        keyGenerator.generate(store.privateKeyPath(record.name()), getSshUsername() + "@" + record.name());
        metrics.recordOperation("create", true);
    }

    public void start() {
        run("start", () -> {
            stopInternal();
            LogicalHost host = host();

            byte[] publicKey = MachineStore.readFile(store.publicKeyPath(record.name()), "public key");
            byte[] userData = record.hasUserData()
                    ? MachineStore.readFile(Path.of(record.userDataPath()), "userdata file")
                    : null;
            byte[] metaData = CloudInitMetadata.forPublicKey(publicKey);

            DesiredObjectSet desired = objectBuilder.build(host.namespace(), host.name(), host.image(), userData, metaData);
            applier.apply(desired);

            String address;
            try {
                address = addressWatcher.awaitAddress(host.namespace(), host.name(), properties.getAddressTimeout());
            } catch (AddressTimeoutException e) {
                log.warn("Machine {} reported no address, tearing it down", host.qualifiedName());
                try {
                    stopInternal();
                } catch (RuntimeException teardown) {
                    e.addSuppressed(teardown);
                }
                throw e;
            }
            runtime.assign(address);
            log.info("Machine {} running at {}", host.qualifiedName(), address);
            return null;
        });
    }

    /**
     * Deletes the machine's workload (its config goes with it). Safe on an absent machine.
     */
    public void stop() {
        run("stop", () -> {
            stopInternal();
            return null;
        });
    }

    public void restart() {
        stop();
        start();
    }

    public void kill() {
        stop();
    }

    /**
     * Removes the machine's cluster objects. Local state is left to the caller.
     */
    public void remove() {
        stop();
    }

    /**
     * Current lifecycle state. A missing workload is reported as {@link HostPhase#ABSENT},
     * not as an error.
     */
    public HostPhase getState() {
        LogicalHost host = host();
        return PhaseMapper.map(cluster.gateway().findWorkload(host.namespace(), host.name()));
    }

    /**
     * The address assigned by the last successful start, or else the address the
     * workload reports within the address timeout.
     */
    public String getAddress() {
        Optional<String> cached = runtime.address();
        if (cached.isPresent()) {
            return cached.get();
        }
        LogicalHost host = host();
        return addressWatcher.awaitAddress(host.namespace(), host.name(), properties.getAddressTimeout());
    }

    /**
     * Remote docker daemon endpoint, e.g. {@code tcp://10.0.0.5:2376}.
     */
    public String getUrl() {
        String address = getAddress();
        String hostPart = address.contains(":") ? "[" + address + "]" : address;
        return "tcp://" + hostPart + ":" + properties.getDockerPort();
    }

    public String getSshHostname() {
        return getAddress();
    }

    public String getSshUsername() {
        return record.sshUser() != null && !record.sshUser().isBlank() ? record.sshUser() : properties.getSshUser();
    }

    public int getSshPort() {
        return record.sshPort() > 0 ? record.sshPort() : properties.getSshPort();
    }

    public Path getSshKeyPath() {
        return store.privateKeyPath(record.name());
    }

    /** Address cached from the last start, without contacting the cluster. */
    public Optional<String> cachedAddress() {
        return runtime.address();
    }

    /**
     * Resolves cluster credentials again; the next operation uses the new connection.
     */
    public void reload() {
        cluster.reload();
    }

    private void stopInternal() {
        LogicalHost host = host();
        try {
            applier.pruneToEmpty(objectBuilder.sentinel(host.namespace(), host.name()));
        } finally {
            runtime.clear();
        }
        log.info("Machine {} stopped", host.qualifiedName());
    }

    private <T> T run(String operation, Supplier<T> body) {
        boolean succeeded = false;
        try {
            MdcContext.setOperation(record.name(), cluster.namespace(), operation);
            T result = body.get();
            succeeded = true;
            return result;
        } finally {
            metrics.recordOperation(operation, succeeded);
            MdcContext.clear();
        }
    }
}
