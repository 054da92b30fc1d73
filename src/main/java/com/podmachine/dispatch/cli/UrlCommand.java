package com.podmachine.dispatch.cli;

import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineLifecycleController;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "url", mixinStandardHelpOptions = true, description = "Show the docker URL of a machine")
@Component
public class UrlCommand extends MachineSubcommand {

    public UrlCommand(MachineControllerFactory factory) {
        super(factory);
    }

    @Override
    protected void execute(MachineRecord record, MachineLifecycleController controller) {
        System.out.println(controller.getUrl());
    }
}
