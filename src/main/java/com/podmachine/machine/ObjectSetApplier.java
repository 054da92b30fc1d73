package com.podmachine.machine;

import com.podmachine.machine.kube.ClusterContext;
import com.podmachine.machine.kube.ClusterGateway;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Makes the cluster match a {@link DesiredObjectSet}.
 *
 * <p>Every object this class applies is labelled with the name of the workload that
 * owns it, and the secret additionally carries an owner reference to the pod. Pruning
 * is scoped to the set's namespace and to objects carrying those labels, so nothing
 * else in the namespace is ever deleted. An owned object whose owner is deleted in the
 * same pass is left to the cluster's garbage collector.
 *
 * <p>API failures propagate unchanged; there is no retry here.
 */
public class ObjectSetApplier {

    private static final Logger log = LoggerFactory.getLogger(ObjectSetApplier.class);

    public static final String OWNER_NAME_LABEL = "podmachine.io/owner-name";
    public static final String OWNER_KIND_LABEL = "podmachine.io/owner-kind";
    public static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY = "podmachine";

    private final ClusterContext cluster;
    private final Duration deleteTimeout;

    public ObjectSetApplier(ClusterContext cluster, Duration deleteTimeout) {
        this.cluster = cluster;
        this.deleteTimeout = deleteTimeout;
    }

    public void apply(DesiredObjectSet set) {
        converge(set, ConvergeIntent.APPLY);
    }

    /**
     * Deletes everything owned for the set's workload. Converging an absent
     * machine to empty is a no-op.
     */
    public void pruneToEmpty(DesiredObjectSet set) {
        converge(set, ConvergeIntent.PRUNE_TO_EMPTY);
    }

    public void converge(DesiredObjectSet set, ConvergeIntent intent) {
        ClusterGateway gateway = cluster.gateway();
        Map<String, String> labels = ownerLabels(set.name());
        Set<String> desired = new HashSet<>();

        if (intent == ConvergeIntent.APPLY) {
            Pod workload = gateway.apply(stampWorkload(set.workload(), labels));
            String uid = workload.getMetadata() != null ? workload.getMetadata().getUid() : null;
            if (uid == null || uid.isBlank()) {
                throw new MachineException("API server returned no UID for workload " + set.namespace() + "/" + set.name());
            }
            Secret config = gateway.apply(stampConfig(set.config(), labels, ownerReference(workload)));
            desired.add(identity(workload));
            desired.add(identity(config));
            log.info("Applied workload {}/{} (uid {}) and its config", set.namespace(), set.name(), uid);
        }

        int pruned = prune(gateway, set.namespace(), labels, desired);
        log.debug("Converged {}/{} with intent {}: {} object(s) pruned", set.namespace(), set.name(), intent, pruned);
    }

    public static Map<String, String> ownerLabels(String workloadName) {
        return Map.of(
                OWNER_NAME_LABEL, workloadName,
                OWNER_KIND_LABEL, "Pod",
                MANAGED_BY_LABEL, MANAGED_BY);
    }

    private int prune(ClusterGateway gateway, String namespace, Map<String, String> labels, Set<String> desired) {
        List<HasMetadata> candidates = gateway.listOwned(namespace, labels).stream()
                .filter(o -> !desired.contains(identity(o)))
                .toList();
        if (candidates.isEmpty()) {
            return 0;
        }

        Set<String> candidateUids = candidates.stream()
                .map(o -> o.getMetadata().getUid())
                .filter(uid -> uid != null && !uid.isBlank())
                .collect(Collectors.toSet());

        var deleted = new ArrayList<HasMetadata>();
        for (HasMetadata object : candidates) {
            if (ownedByAny(object, candidateUids)) {
                log.debug("Leaving {} to garbage collection with its owner", identity(object));
                continue;
            }
            gateway.delete(object);
            deleted.add(object);
            log.info("Deleted {} in {}", identity(object), namespace);
        }

        // Wait for cascaded dependents too, so a following apply never lands on a terminating object.
        for (HasMetadata object : candidates) {
            gateway.awaitRemoval(object, deleteTimeout);
        }
        return candidates.size();
    }

    private static boolean ownedByAny(HasMetadata object, Set<String> uids) {
        List<OwnerReference> refs = object.getMetadata().getOwnerReferences();
        if (refs == null) {
            return false;
        }
        return refs.stream().anyMatch(ref -> uids.contains(ref.getUid()));
    }

    private static Pod stampWorkload(Pod workload, Map<String, String> labels) {
        return new PodBuilder(workload)
                .editMetadata()
                    .addToLabels(labels)
                .endMetadata()
                .build();
    }

    private static Secret stampConfig(Secret config, Map<String, String> labels, OwnerReference owner) {
        return new SecretBuilder(config)
                .editMetadata()
                    .addToLabels(labels)
                    .withOwnerReferences(owner)
                .endMetadata()
                .build();
    }

    private static OwnerReference ownerReference(Pod workload) {
        return new OwnerReferenceBuilder()
                .withApiVersion(workload.getApiVersion())
                .withKind(workload.getKind())
                .withName(workload.getMetadata().getName())
                .withUid(workload.getMetadata().getUid())
                .withController(true)
                .withBlockOwnerDeletion(false)
                .build();
    }

    static String identity(HasMetadata object) {
        return object.getKind() + "/" + object.getMetadata().getName();
    }
}
