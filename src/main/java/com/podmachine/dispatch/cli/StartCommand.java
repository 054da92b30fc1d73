package com.podmachine.dispatch.cli;

import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineLifecycleController;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: podmachine start &lt;name&gt;
 * <p>
 * Recreates the machine pod from scratch and waits for its address.
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Start a machine")
@Component
public class StartCommand extends MachineSubcommand {

    public StartCommand(MachineControllerFactory factory) {
        super(factory);
    }

    @Override
    protected void execute(MachineRecord record, MachineLifecycleController controller) {
        ConsoleOutput.machine(record.name(), "Starting...");
        controller.start();
        ConsoleOutput.success(record.name() + " is running at " + controller.getUrl());
    }
}
