package com.podmachine.dispatch.cli;

import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineLifecycleController;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "restart", mixinStandardHelpOptions = true, description = "Restart a machine")
@Component
public class RestartCommand extends MachineSubcommand {

    public RestartCommand(MachineControllerFactory factory) {
        super(factory);
    }

    @Override
    protected void execute(MachineRecord record, MachineLifecycleController controller) {
        controller.restart();
        ConsoleOutput.success(record.name() + " is running at " + controller.getUrl());
    }
}
