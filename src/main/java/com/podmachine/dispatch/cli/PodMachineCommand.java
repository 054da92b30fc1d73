package com.podmachine.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for podmachine.
 */
@Command(
        name = "podmachine",
        mixinStandardHelpOptions = true,
        version = "podmachine 0.1.0",
        description = "Docker hosts running as pods on a Kubernetes cluster",
        subcommands = {
                CreateCommand.class,
                StartCommand.class,
                StopCommand.class,
                RestartCommand.class,
                KillCommand.class,
                RemoveCommand.class,
                StatusCommand.class,
                IpCommand.class,
                UrlCommand.class,
                InspectCommand.class,
                ListCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PodMachineCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
