package com.podmachine.dispatch.cli;

import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineLifecycleController;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "ip", mixinStandardHelpOptions = true, description = "Show the IP address of a machine")
@Component
public class IpCommand extends MachineSubcommand {

    public IpCommand(MachineControllerFactory factory) {
        super(factory);
    }

    @Override
    protected void execute(MachineRecord record, MachineLifecycleController controller) {
        System.out.println(controller.getAddress());
    }
}
