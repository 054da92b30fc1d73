package com.podmachine.dispatch.cli;

import com.podmachine.core.model.HostPhase;
import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineException;
import com.podmachine.machine.MachineLifecycleController;
import com.podmachine.machine.kube.ClusterContext;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: podmachine ls
 * <p>
 * Lists stored machines with their live state. A machine whose state cannot
 * be read is shown as Error; the rest of the listing continues.
 */
@Command(name = "ls", mixinStandardHelpOptions = true, description = "List machines")
@Component
public class ListCommand implements Callable<Integer> {

    @Mixin
    private ClusterOptions clusterOptions = new ClusterOptions();

    private final MachineControllerFactory factory;

    public ListCommand(MachineControllerFactory factory) {
        this.factory = factory;
    }

    @Override
    public Integer call() {
        List<MachineRecord> records;
        try {
            records = factory.store().list();
        } catch (MachineException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        if (records.isEmpty()) {
            ConsoleOutput.info("No machines found");
            return 0;
        }

        System.out.printf("  %-20s %-12s %-10s %s%n", "NAME", "DRIVER", "STATE", "URL");
        System.out.println("  " + "-".repeat(64));
        try (ClusterContext cluster = factory.openCluster(clusterOptions.kubeconfigToken())) {
            for (MachineRecord record : records) {
                MachineLifecycleController controller = factory.controllerFor(record, cluster);
                String state;
                String url = "";
                try {
                    HostPhase phase = controller.getState();
                    state = ConsoleOutput.display(phase);
                    if (phase == HostPhase.RUNNING) {
                        url = controller.getUrl();
                    }
                } catch (MachineException | KubernetesClientException e) {
                    state = "Error";
                    url = e.getMessage();
                }
                System.out.printf("  %-20s %-12s %-10s %s%n", record.name(), record.driverName(), state, url);
            }
        }
        return 0;
    }
}
