package com.podmachine.dispatch.cli;

import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineException;
import com.podmachine.machine.MachineLifecycleController;
import com.podmachine.machine.kube.ClusterContext;
import io.fabric8.kubernetes.client.KubernetesClientException;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * Base for commands that operate on one existing machine.
 * Failures are printed and turned into exit code 1.
 */
public abstract class MachineSubcommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Machine name")
    protected String machineName;

    @Mixin
    protected ClusterOptions clusterOptions = new ClusterOptions();

    protected final MachineControllerFactory factory;

    protected MachineSubcommand(MachineControllerFactory factory) {
        this.factory = factory;
    }

    @Override
    public Integer call() {
        try {
            MachineRecord record = factory.store().require(machineName);
            try (ClusterContext cluster = factory.openCluster(clusterOptions.kubeconfigToken())) {
                execute(record, factory.controllerFor(record, cluster));
            }
            return 0;
        } catch (MachineException | KubernetesClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    protected abstract void execute(MachineRecord record, MachineLifecycleController controller);
}
