package com.podmachine.machine;

/**
 * Base class for failures raised by machine lifecycle operations.
 *
 * <p>Errors from the Kubernetes API itself are not wrapped; they surface as
 * fabric8 {@code KubernetesClientException}s.
 */
public class MachineException extends RuntimeException {
    public MachineException(String message) {
        super(message);
    }

    public MachineException(String message, Throwable cause) {
        super(message, cause);
    }
}
