package org.dxworks.codegraph.cli;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.codegraph.engine.InvalidRequestException;
import picocli.CommandLine;

@CommandLine.Command(
        name = "codegraph",
        mixinStandardHelpOptions = true,
        version = "codegraph 1.0.0",
        description = "Builds syntax, control-flow, data-flow, call, dependency and program-dependency graphs from source code.",
        subcommands = {
                SyntaxTreeCommand.class,
                ControlFlowCommand.class,
                DataFlowCommand.class,
                CallGraphCommand.class,
                DependencyGraphCommand.class,
                ProgramDependencyCommand.class,
                AllGraphsCommand.class
        })
public final class App implements Runnable {
    private static final Logger logger = LogManager.getLogger(App.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    public static CommandLine commandLine() {
        return new CommandLine(new App())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                    if (e instanceof InvalidRequestException) {
                        logger.debug("Invalid request", e);
                        commandLine.getErr().println("Error: " + e.getMessage());
                        commandLine.getErr().flush();
                        return 1;
                    }
                    throw e;
                });
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
