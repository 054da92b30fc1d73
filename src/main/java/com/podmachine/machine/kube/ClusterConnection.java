package com.podmachine.machine.kube;

/**
 * A resolved cluster: the working namespace plus an authenticated gateway.
 *
 * @param namespace namespace machines are created in
 * @param masterUrl API server URL, for display
 * @param gateway   API access
 */
public record ClusterConnection(
    String namespace,
    String masterUrl,
    ClusterGateway gateway
) implements AutoCloseable {

    @Override
    public void close() {
        gateway.close();
    }
}
