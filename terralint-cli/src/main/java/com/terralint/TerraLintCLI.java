package com.terralint;

import com.terralint.cli.LintCommand;
import com.terralint.cli.ListCommand;
import com.terralint.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for TerraLint.
 *
 * <p>TerraLint checks Terraform configurations against style, input/output, documentation
 * and security conventions without running Terraform.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code lint} - Lint a directory of Terraform files</li>
 *   <li>{@code list} - List rules or rule categories</li>
 *   <li>{@code validate} - Validate a configuration file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Lint the current directory
 * terralint lint
 *
 * # Only style rules, JSON report next to the sources
 * terralint lint ./infra --categories ST --report-format json --report-dir ./reports
 *
 * # List available rules
 * terralint list rules
 * }</pre>
 */
@Command(
    name = "terralint",
    mixinStandardHelpOptions = true,
    version = "TerraLint 1.0.0-SNAPSHOT",
    description = "Static analysis for Terraform configurations",
    subcommands = {
        LintCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class TerraLintCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("TerraLint - Static analysis for Terraform configurations");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'terralint --help' to see available commands");
        System.out.println("Use 'terralint <command> --help' for command-specific help");
    }

    /**
     * Applies the global logging options, then runs the most specific command given.
     *
     * @param parseResult parsed command line
     * @return exit code of the executed command
     */
    int execute(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with the logging-aware execution strategy.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        TerraLintCLI cli = new TerraLintCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::execute);
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
