package com.podmachine.machine;

/**
 * Thrown when the workload backing a machine does not exist in the cluster.
 */
public class MachineNotFoundException extends MachineException {

    private final String namespace;
    private final String name;

    public MachineNotFoundException(String namespace, String name) {
        super("Workload " + namespace + "/" + name + " not found");
        this.namespace = namespace;
        this.name = name;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }
}
