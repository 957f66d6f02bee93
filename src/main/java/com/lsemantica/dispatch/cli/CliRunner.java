package com.lsemantica.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle and owns the process exit code.
 * <p>
 * Exit codes: {@value CommandSupport#EXIT_OK} when the command succeeded or its decision allows
 * continuation, {@value CommandSupport#EXIT_ERROR} for invalid input, usage mistakes and unexpected
 * failures, {@value CommandSupport#EXIT_BLOCKED} only when a governance decision stops or escalates.
 * picocli's default usage code collides with the blocked code, so parameter errors are remapped.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final LsemanticaCommand lsemanticaCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(LsemanticaCommand lsemanticaCommand, IFactory factory) {
        this.lsemanticaCommand = lsemanticaCommand;
        this.factory = factory;
    }

    /** Builds the command line with this tool's exit-code mapping applied. */
    static CommandLine commandLine(LsemanticaCommand root, IFactory factory) {
        CommandLine cmd = new CommandLine(root, factory);
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine source = ex.getCommandLine();
            source.getErr().println(source.getColorScheme().errorText(ex.getMessage()));
            if (!CommandLine.UnmatchedArgumentException.printSuggestions(ex, source.getErr())) {
                ex.getCommandLine().usage(source.getErr(), source.getColorScheme());
            }
            return CommandSupport.EXIT_ERROR;
        });
        cmd.setExecutionExceptionHandler((ex, source, parseResult) -> {
            log.error("Command '{}' failed unexpectedly", source.getCommandName(), ex);
            source.getErr().println(source.getColorScheme().errorText("Error: " + ex.getMessage()));
            return CommandSupport.EXIT_ERROR;
        });
        return cmd;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(lsemanticaCommand, factory).execute(args);
        if (exitCode == CommandSupport.EXIT_BLOCKED) {
            log.info("Command finished blocked by a governance decision (exit {})", exitCode);
        } else {
            log.debug("Command finished with exit code {}", exitCode);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
