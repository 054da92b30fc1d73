package com.podmachine.machine.kube;

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link ClusterGateway} backed by the fabric8 Kubernetes client.
 */
public class Fabric8ClusterGateway implements ClusterGateway {

    private static final Logger log = LoggerFactory.getLogger(Fabric8ClusterGateway.class);

    private final KubernetesClient client;
    private final String fieldManager;

    public Fabric8ClusterGateway(KubernetesClient client, String fieldManager) {
        this.client = client;
        this.fieldManager = fieldManager != null && !fieldManager.isBlank() ? fieldManager : "podmachine";
    }

    @Override
    public Optional<Pod> findWorkload(String namespace, String name) {
        return Optional.ofNullable(client.pods().inNamespace(namespace).withName(name).get());
    }

    @Override
    public List<HasMetadata> listOwned(String namespace, Map<String, String> ownerLabels) {
        var owned = new ArrayList<HasMetadata>();
        owned.addAll(client.pods().inNamespace(namespace).withLabels(ownerLabels).list().getItems());
        owned.addAll(client.secrets().inNamespace(namespace).withLabels(ownerLabels).list().getItems());
        return owned;
    }

    @Override
    public <T extends HasMetadata> T apply(T object) {
        log.debug("Applying {} {}/{}", object.getKind(),
                object.getMetadata().getNamespace(), object.getMetadata().getName());
        return client.resource(object)
                .inNamespace(object.getMetadata().getNamespace())
                .fieldManager(fieldManager)
                .forceConflicts()
                .serverSideApply();
    }

    @Override
    public void delete(HasMetadata object) {
        log.debug("Deleting {} {}/{}", object.getKind(),
                object.getMetadata().getNamespace(), object.getMetadata().getName());
        client.resource(object)
                .inNamespace(object.getMetadata().getNamespace())
                .withPropagationPolicy(DeletionPropagation.BACKGROUND)
                .delete();
    }

    @Override
    public void awaitRemoval(HasMetadata object, Duration timeout) {
        client.resource(object)
                .inNamespace(object.getMetadata().getNamespace())
                .waitUntilCondition(Objects::isNull, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public WatchSession watchWorkload(String namespace, String name, WorkloadEventListener listener) {
        Watch watch = client.pods().inNamespace(namespace).withName(name).watch(new Watcher<Pod>() {
            @Override
            public void eventReceived(Action action, Pod pod) {
                listener.onEvent(WorkloadEventListener.EventType.valueOf(action.name()), pod);
            }

            @Override
            public void onClose() {
                listener.onClose(null);
            }

            @Override
            public void onClose(WatcherException cause) {
                listener.onClose(cause.asClientException());
            }
        });
        return watch::close;
    }

    @Override
    public String serverVersion() {
        return client.getKubernetesVersion().getGitVersion();
    }

    @Override
    public void close() {
        client.close();
    }
}
