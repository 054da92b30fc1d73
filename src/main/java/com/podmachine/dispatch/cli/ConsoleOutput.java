package com.podmachine.dispatch.cli;

import com.podmachine.core.model.HostPhase;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the podmachine CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PODMACHINE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void machine(String name, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [" + name + "]|@ " + message));
    }

    public static String phase(HostPhase phase) {
        String color = switch (phase) {
            case RUNNING -> "fg(green)";
            case STARTING -> "fg(yellow)";
            case STOPPED -> "fg(red)";
            case ABSENT -> "faint";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + display(phase) + "|@");
    }

    /** Docker-machine style state name: "Running", "Stopped", ... */
    public static String display(HostPhase phase) {
        String name = phase.name();
        return name.charAt(0) + name.substring(1).toLowerCase();
    }
}
