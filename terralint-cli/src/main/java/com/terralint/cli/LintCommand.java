package com.terralint.cli;

import com.terralint.core.config.ConfigLoader;
import com.terralint.core.config.ConfigurationException;
import com.terralint.core.config.LintConfig;
import com.terralint.core.engine.LintEngine;
import com.terralint.core.engine.LintOptions;
import com.terralint.core.engine.LintReport;
import com.terralint.core.engine.SourceDiscovery;
import com.terralint.core.report.ConsoleReporter;
import com.terralint.core.report.ReportFormat;
import com.terralint.core.report.ReportWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to lint a directory of Terraform files.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load {@code terralint.yaml} and apply command-line overrides</li>
 *   <li>Discover {@code .tf} and {@code .tfvars} files</li>
 *   <li>Run the selected rules</li>
 *   <li>Print violations and optionally write report files</li>
 * </ol>
 *
 * <p><b>Exit codes:</b> {@code 0} no errors (warnings allowed), {@code 1} at least one error,
 * {@code 2} invalid configuration or no Terraform files found.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Lint the current directory
 * terralint lint
 *
 * # Skip two rules and leave out a directory
 * terralint lint ./infra --ignore-rules ST.009,IO.009 --exclude-paths examples
 * }</pre>
 */
@Command(
    name = "lint",
    description = "Lint Terraform files below a directory",
    mixinStandardHelpOptions = true
)
public class LintCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(LintCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Directory or file to lint (default: current directory)",
        defaultValue = "."
    )
    private Path target;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: terralint.yaml in the target)")
    private Path configPath;

    @Option(names = "--ignore-rules", split = ",", description = "Rule ids to skip, e.g. ST.009,IO.009")
    private List<String> ignoreRules;

    @Option(names = "--categories", split = ",", description = "Rule categories to run: ST, IO, DC, SC")
    private List<String> categories;

    @Option(names = "--severities", split = ",", description = "Severities to report: error, warning")
    private List<String> severities;

    @Option(names = "--include-paths", split = ",", description = "Globs a file must match, relative to the target")
    private List<String> includePaths;

    @Option(names = "--exclude-paths", split = ",", description = "Directory names or globs to skip")
    private List<String> excludePaths;

    @Option(names = "--report-format", description = "Report file format: text, json or both")
    private String reportFormat;

    @Option(names = "--report-dir", description = "Directory for report files (no files are written without it)")
    private Path reportDir;

    @Option(names = "--parallelism", description = "Worker threads, 0 for one per processor")
    private Integer parallelism;

    @Option(names = "--no-color", description = "Disable ANSI colours")
    private boolean noColor;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Path root = target.toAbsolutePath().normalize();
            if (!Files.exists(root)) {
                err.println("✗ Path does not exist: " + root);
                return EXIT_USAGE;
            }
            log.info("Starting lint of: {}", root);

            LintConfig config = applyOverrides(loadConfiguration(root));
            LintOptions options = LintOptions.from(config);
            ReportFormat format = ReportFormat.fromString(config.report().format());

            List<Path> files = new SourceDiscovery(config.paths().include(), config.paths().exclude()).discover(root);
            if (files.isEmpty()) {
                err.println("✗ No Terraform files found in: " + root);
                return EXIT_USAGE;
            }

            LintReport report = new LintEngine().run(files, options);
            new ConsoleReporter(out, useColors()).print(report);

            if (config.report().directory() != null) {
                for (Path written : new ReportWriter().write(report, format, Path.of(config.report().directory()))) {
                    out.println("✓ Report written to: " + written);
                }
            }
            return report.hasErrors() ? EXIT_ERRORS : EXIT_OK;

        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("✗ Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        } catch (Exception e) {
            log.error("Lint failed", e);
            err.println("✗ Lint failed: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    /**
     * Loads the configuration. An explicit {@code --config} must exist and parse; the
     * implicit {@code terralint.yaml} in the target falls back to defaults.
     */
    private LintConfig loadConfiguration(Path root) {
        if (configPath != null) {
            log.debug("Loading configuration from: {}", configPath);
            return ConfigLoader.loadStrict(configPath);
        }
        Path directory = Files.isDirectory(root) ? root : root.getParent();
        Path implicit = directory.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        if (Files.exists(implicit)) {
            return ConfigLoader.load(implicit);
        }
        log.debug("No {} found, using defaults", ConfigLoader.DEFAULT_FILE_NAME);
        return LintConfig.defaults();
    }

    private LintConfig applyOverrides(LintConfig config) {
        LintConfig.RulesConfig rules = new LintConfig.RulesConfig(
            categories != null ? categories : config.rules().categories(),
            ignoreRules != null ? ignoreRules : config.rules().excluded(),
            severities != null ? severities : config.rules().severities());
        LintConfig.PathsConfig paths = new LintConfig.PathsConfig(
            includePaths != null ? includePaths : config.paths().include(),
            excludePaths != null ? excludePaths : config.paths().exclude());
        LintConfig.ExecutionConfig execution = new LintConfig.ExecutionConfig(
            parallelism != null ? parallelism : config.execution().parallelism());
        LintConfig.ReportConfig report = new LintConfig.ReportConfig(
            reportFormat != null ? reportFormat : config.report().format(),
            reportDir != null ? reportDir.toString() : config.report().directory());

        return new LintConfig(rules, paths, config.files(), config.naming(), config.variables(),
            config.versions(), execution, report);
    }

    private boolean useColors() {
        return !noColor && System.console() != null;
    }
}
