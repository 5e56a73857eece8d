package com.switchyard.dispatch.cli;

import com.switchyard.SwitchyardApplication;
import com.switchyard.core.model.RouterException;
import com.switchyard.core.queue.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command for the given arguments and reports its exit code to
 * Spring Boot. Does nothing in serve mode, where the web server owns the process.
 * <p>
 * Router errors that escape a command print as {@code KIND: message} and exit with
 * {@value #EXIT_FAILED}; an unreachable job store exits with {@value #EXIT_STORE_UNAVAILABLE}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILED = 1;
    static final int EXIT_STORE_UNAVAILABLE = 3;

    private final SwitchyardCommand switchyardCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SwitchyardCommand switchyardCommand, IFactory factory) {
        this.switchyardCommand = switchyardCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (SwitchyardApplication.isServeMode(args)) {
            return;
        }
        exitCode = commandLine(switchyardCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CommandLine commandLine(SwitchyardCommand root, IFactory factory) {
        return new CommandLine(root, factory).setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof RouterException re) {
                ConsoleOutput.error(re.kind() + ": " + re.getMessage());
                return EXIT_FAILED;
            }
            if (ex instanceof JobStoreException) {
                log.error("Job store failure in '{}'", cmd.getCommandName(), ex);
                ConsoleOutput.error("Job store unavailable: " + ex.getMessage());
                return EXIT_STORE_UNAVAILABLE;
            }
            throw ex;
        });
    }
}
