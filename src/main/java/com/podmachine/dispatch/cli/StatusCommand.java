package com.podmachine.dispatch.cli;

import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineLifecycleController;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: podmachine status &lt;name&gt;
 * <p>
 * Prints Running, Starting, Stopped or Absent.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the state of a machine")
@Component
public class StatusCommand extends MachineSubcommand {

    public StatusCommand(MachineControllerFactory factory) {
        super(factory);
    }

    @Override
    protected void execute(MachineRecord record, MachineLifecycleController controller) {
        System.out.println(ConsoleOutput.display(controller.getState()));
    }
}
