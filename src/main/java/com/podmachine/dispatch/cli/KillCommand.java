package com.podmachine.dispatch.cli;

import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineLifecycleController;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/** Same as stop: the pod is deleted with a zero grace period. */
@Command(name = "kill", mixinStandardHelpOptions = true, description = "Kill a machine")
@Component
public class KillCommand extends MachineSubcommand {

    public KillCommand(MachineControllerFactory factory) {
        super(factory);
    }

    @Override
    protected void execute(MachineRecord record, MachineLifecycleController controller) {
        controller.kill();
        ConsoleOutput.success(record.name() + " killed");
    }
}
