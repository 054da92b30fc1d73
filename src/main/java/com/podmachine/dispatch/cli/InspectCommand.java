package com.podmachine.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.podmachine.core.model.MachineRecord;
import com.podmachine.machine.MachineControllerFactory;
import com.podmachine.machine.MachineException;
import com.podmachine.machine.MachineLifecycleController;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.LinkedHashMap;

/**
 * CLI command: podmachine inspect &lt;name&gt;
 * <p>
 * Prints the stored machine record and its SSH settings as JSON. Does not contact the cluster.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Show machine details as JSON")
@Component
public class InspectCommand extends MachineSubcommand {

    private final ObjectMapper objectMapper;

    public InspectCommand(MachineControllerFactory factory, ObjectMapper objectMapper) {
        super(factory);
        this.objectMapper = objectMapper;
    }

    @Override
    protected void execute(MachineRecord record, MachineLifecycleController controller) {
        var details = new LinkedHashMap<String, Object>();
        details.put("name", record.name());
        details.put("driver", record.driverName());
        details.put("image", record.image());
        details.put("userData", record.userDataPath());
        details.put("createdAt", record.createdAt());
        details.put("sshUser", controller.getSshUsername());
        details.put("sshPort", controller.getSshPort());
        details.put("sshKeyPath", controller.getSshKeyPath().toString());
        try {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(details));
        } catch (JsonProcessingException e) {
            throw new MachineException("Cannot render machine " + record.name(), e);
        }
    }
}
