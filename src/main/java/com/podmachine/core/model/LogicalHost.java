package com.podmachine.core.model;

/**
 * Immutable identity of a logical docker host.
 *
 * @param name      unique within the namespace; names both the pod and the secret
 * @param namespace namespace resolved from the cluster connection
 * @param image     container image the workload runs
 */
public record LogicalHost(
    String name,
    String namespace,
    String image
) {
    public LogicalHost {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Host name must not be blank");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Namespace must not be blank");
        }
    }

    public String qualifiedName() {
        return namespace + "/" + name;
    }
}
