package com.terralint.cli;

import com.terralint.core.config.ConfigLoader;
import com.terralint.core.config.ConfigurationException;
import com.terralint.core.config.LintConfig;
import com.terralint.core.engine.LintOptions;
import com.terralint.core.report.ReportFormat;
import com.terralint.core.rule.RuleRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file without linting anything.
 *
 * <p>Checks that the file parses and that every rule id, category, severity and report format
 * it names is known.
 */
@Command(
    name = "validate",
    description = "Validate a terralint.yaml configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        log.info("Validating configuration: {}", configFile);
        try {
            LintConfig config = ConfigLoader.loadStrict(configFile);
            RuleRegistry.builtIn().validate(
                config.rules().categories(), config.rules().excluded(), config.rules().severities());
            LintOptions.from(config);
            ReportFormat.fromString(config.report().format());

            out.println("✓ Configuration is valid: " + configFile);
            return 0;
        } catch (ConfigurationException e) {
            log.error("Invalid configuration {}: {}", configFile, e.getMessage());
            spec.commandLine().getErr().println("✗ Invalid configuration: " + e.getMessage());
            return 1;
        }
    }
}
