package com.switchyard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Switchyard.
 */
@Command(
        name = "switchyard",
        mixinStandardHelpOptions = true,
        version = "Switchyard 0.1.0",
        description = "Routes tool invocations to local, remote or deferred execution",
        subcommands = {
                ExecuteCommand.class,
                QueueCommand.class,
                MetricsCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwitchyardCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
