package com.podmachine.machine;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Secret;

import java.util.List;

/**
 * The objects that make up one logical host: the workload pod and the secret
 * holding its cloud-init payloads. Both share the host's name and namespace.
 *
 * @param workload the pod; owner of the secret
 * @param config   the secret mounted into the pod
 */
public record DesiredObjectSet(
    Pod workload,
    Secret config
) {
    public String name() {
        return workload.getMetadata().getName();
    }

    public String namespace() {
        return workload.getMetadata().getNamespace();
    }

    /** Objects in apply order: owner first. */
    public List<HasMetadata> objects() {
        return List.of(workload, config);
    }
}
