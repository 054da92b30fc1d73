package com.podmachine.machine;

/**
 * Thrown when credentials, local files or stored machine configuration are
 * missing or unusable. Retrying without changing the configuration will not help.
 */
public class MachineConfigurationException extends MachineException {
    public MachineConfigurationException(String message) {
        super(message);
    }

    public MachineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
