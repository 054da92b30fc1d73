package com.podmachine.machine.kube;

/**
 * Handle for an open watch. Closing it releases the server-side subscription;
 * closing more than once is harmless.
 */
@FunctionalInterface
public interface WatchSession extends AutoCloseable {

    @Override
    void close();
}
