package com.podmachine.machine.kube;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Holds the cluster connection a controller works against.
 *
 * <p>The connection is resolved on first use and then reused; credential changes
 * only take effect after an explicit {@link #reload()}.
 */
public class ClusterContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClusterContext.class);

    private final Supplier<ClusterConnection> connector;
    private ClusterConnection connection;

    public ClusterContext(Supplier<ClusterConnection> connector) {
        this.connector = connector;
    }

    public synchronized String namespace() {
        return current().namespace();
    }

    public synchronized String masterUrl() {
        return current().masterUrl();
    }

    public synchronized ClusterGateway gateway() {
        return current().gateway();
    }

    /**
     * Drops the current connection and resolves credentials again.
     */
    public synchronized void reload() {
        ClusterConnection previous = connection;
        connection = connector.get();
        log.info("Reloaded cluster connection (namespace {})", connection.namespace());
        if (previous != null) {
            previous.close();
        }
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            connection.close();
            connection = null;
        }
    }

    private ClusterConnection current() {
        if (connection == null) {
            connection = connector.get();
        }
        return connection;
    }
}
