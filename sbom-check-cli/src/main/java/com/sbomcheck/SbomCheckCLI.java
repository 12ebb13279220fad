package com.sbomcheck;

import ch.qos.logback.classic.Level;
import com.sbomcheck.cli.ListCommand;
import com.sbomcheck.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for sbom-check.
 *
 * <p>sbom-check validates SPDX 2.3 JSON documents against the SPDX specification and a
 * configurable minimum-required-values policy.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Validate a directory or file of SPDX JSON documents</li>
 *   <li>{@code list} - List available rules or renderers</li>
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
 * # Validate every *.spdx.json in a folder and print the results
 * sbom-check validate ./sboms --print-console
 *
 * # Specification rules only, JSON results, debug logging
 * sbom-check -v validate ./sboms --rule-sets specification --print-json
 *
 * # List the specification and policy rules
 * sbom-check list rules
 * }</pre>
 */
@Command(
    name = "sbom-check",
    mixinStandardHelpOptions = true,
    version = "sbom-check 1.0.0-SNAPSHOT",
    description = "Validates SPDX 2.3 SBOM documents against the specification and a completeness policy",
    subcommands = {
        ValidateCommand.class,
        ListCommand.class
    }
)
public class SbomCheckCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SbomCheckCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("sbom-check - SPDX 2.3 SBOM validator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'sbom-check --help' to see available commands");
        System.out.println("Use 'sbom-check <command> --help' for command-specific help");
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
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Creates a configured command line.
     *
     * <p>Global logging options are applied before whichever subcommand runs.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        SbomCheckCLI cli = new SbomCheckCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
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
