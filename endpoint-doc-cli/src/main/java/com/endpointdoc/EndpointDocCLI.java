package com.endpointdoc;

import com.endpointdoc.cli.BuildCommand;
import com.endpointdoc.cli.ListCommand;
import com.endpointdoc.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for EndpointDoc.
 *
 * <p>EndpointDoc turns endpoint descriptors (routes, verbs, request and response shapes, binding
 * hints) into an OpenAPI document.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code build} - Build the document and write it to disk or the console</li>
 *   <li>{@code validate} - Run the pipeline and report fatal descriptor errors</li>
 *   <li>{@code list} - List available processors or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Build openapi.json from a directory of descriptors
 * endpointdoc build endpoints/ -o docs/api
 *
 * # Print YAML to the console
 * endpointdoc build endpoints.yaml --format yaml --console
 *
 * # List registered operation processors
 * endpointdoc list processors
 * }</pre>
 */
@Command(
    name = "endpointdoc",
    mixinStandardHelpOptions = true,
    version = "EndpointDoc 1.0.0-SNAPSHOT",
    description = "OpenAPI document generator for endpoint descriptors",
    subcommands = {
        BuildCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class EndpointDocCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(EndpointDocCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("EndpointDoc - OpenAPI Document Generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'endpointdoc --help' to see available commands");
        System.out.println("Use 'endpointdoc <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        EndpointDocCLI cli = new EndpointDocCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
