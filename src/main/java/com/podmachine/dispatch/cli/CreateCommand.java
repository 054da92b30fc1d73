package com.podmachine.dispatch.cli;

import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.MachineConfigurationException;
import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineException;
import com.podmachine.machine.MachineLifecycleController;
import com.podmachine.machine.kube.ClusterContext;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: podmachine create &lt;name&gt;
 * <p>
 * Records the machine locally, generates its SSH keypair and, unless
 * {@code --no-start} is given, starts it.
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create a machine")
@Component
public class CreateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Machine name")
    private String machineName;

    @Option(names = "--kubernetes-image",
            description = "Container image for the machine (env: KUBERNETES_IMAGE)",
            defaultValue = "${env:KUBERNETES_IMAGE}")
    private String image;

    @Option(names = "--kubernetes-userdata",
            description = "Path to a cloud-init user-data file (env: KUBERNETES_USERDATA)",
            defaultValue = "${env:KUBERNETES_USERDATA}")
    private String userData;

    @Option(names = "--no-start", description = "Only record the machine and generate its keys")
    private boolean noStart;

    @Mixin
    private ClusterOptions clusterOptions = new ClusterOptions();

    private final MachineControllerFactory factory;

    public CreateCommand(MachineControllerFactory factory) {
        this.factory = factory;
    }

    @Override
    public Integer call() {
        try {
            if (factory.store().exists(machineName)) {
                throw new MachineConfigurationException("Machine " + machineName + " already exists");
            }
            MachineRecord record = factory.newRecord(machineName, image, userData);
            try (ClusterContext cluster = factory.openCluster(clusterOptions.kubeconfigToken())) {
                MachineLifecycleController controller = factory.controllerFor(record, cluster);
                controller.preCreateCheck();
                factory.store().save(record);
                controller.create();
                ConsoleOutput.machine(machineName, "Created with image " + record.image());

                if (!noStart) {
                    ConsoleOutput.machine(machineName, "Starting...");
                    controller.start();
                    ConsoleOutput.success(machineName + " is running at " + controller.getUrl());
                }
            }
            return 0;
        } catch (MachineException | KubernetesClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
