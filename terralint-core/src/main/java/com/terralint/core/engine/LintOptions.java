package com.terralint.core.engine;

import com.terralint.core.config.ConfigurationException;
import com.terralint.core.config.LintConfig;
import com.terralint.core.rule.RuleSettings;

import java.util.List;
import java.util.Objects;

/**
 * Options of one lint run: rule selection, parallelism and rule settings.
 *
 * @param categories category codes to run, empty for all
 * @param excludedRules rule ids to skip
 * @param severities severities to report, empty for all
 * @param parallelism worker threads for the per-file pass, 0 for the number of processors
 * @param settings settings handed to every rule
 */
public record LintOptions(
    List<String> categories,
    List<String> excludedRules,
    List<String> severities,
    int parallelism,
    RuleSettings settings
) {
    /**
     * Compact constructor with validation.
     */
    public LintOptions {
        Objects.requireNonNull(settings, "settings must not be null");
        categories = categories == null ? List.of() : List.copyOf(categories);
        excludedRules = excludedRules == null ? List.of() : List.copyOf(excludedRules);
        severities = severities == null ? List.of() : List.copyOf(severities);
        if (parallelism < 0) {
            throw new ConfigurationException("parallelism must not be negative: " + parallelism);
        }
    }

    /**
     * Creates options from a loaded configuration.
     *
     * @param config lint configuration
     * @return options
     */
    public static LintOptions from(LintConfig config) {
        return new LintOptions(
            config.rules().categories(),
            config.rules().excluded(),
            config.rules().severities(),
            config.execution().parallelism(),
            RuleSettings.from(config)
        );
    }

    public static LintOptions defaults() {
        return from(LintConfig.defaults());
    }

    /**
     * Number of worker threads to use.
     *
     * @return configured parallelism, or the number of available processors when 0
     */
    public int effectiveParallelism() {
        return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }
}
