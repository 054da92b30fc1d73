package com.podmachine.dispatch.cli;

import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineException;
import com.podmachine.machine.MachineLifecycleController;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: podmachine rm &lt;name&gt;
 * <p>
 * Deletes the machine's cluster objects, then its local directory.
 * With {@code --force} the local directory is deleted even when the cluster is unreachable.
 */
@Command(name = "rm", mixinStandardHelpOptions = true, description = "Remove a machine")
@Component
public class RemoveCommand extends MachineSubcommand {

    @Option(names = {"-f", "--force"}, description = "Remove local state even if cluster cleanup fails")
    private boolean force;

    public RemoveCommand(MachineControllerFactory factory) {
        super(factory);
    }

    @Override
    protected void execute(MachineRecord record, MachineLifecycleController controller) {
        try {
            controller.remove();
        } catch (MachineException | KubernetesClientException e) {
            if (!force) {
                throw e;
            }
            ConsoleOutput.error("Cluster cleanup failed, removing local state anyway: " + e.getMessage());
        }
        factory.store().delete(record.name());
        ConsoleOutput.success("Removed " + record.name());
    }
}
