package com.terralint.core.rule;

import com.terralint.core.config.LintConfig;
import com.terralint.core.oracle.KnownReleasesVersionOracle;
import com.terralint.core.oracle.ProviderVersionOracle;

import java.util.List;
import java.util.Objects;

/**
 * Read-only settings shared by all rules of a run.
 *
 * @param instanceName required instance label of resource and data blocks
 * @param files canonical file names
 * @param allowList variable names exempt from declaration, ordering and usage checks
 * @param allowPrefixes variable name prefixes exempt from the same checks
 * @param providers providers whose version constraints are checked
 * @param oracle provider version oracle
 */
public record RuleSettings(
    String instanceName,
    LintConfig.FilesConfig files,
    List<String> allowList,
    List<String> allowPrefixes,
    List<String> providers,
    ProviderVersionOracle oracle
) {
    /**
     * Compact constructor with validation.
     */
    public RuleSettings {
        Objects.requireNonNull(instanceName, "instanceName must not be null");
        Objects.requireNonNull(files, "files must not be null");
        Objects.requireNonNull(oracle, "oracle must not be null");
        allowList = allowList == null ? List.of() : List.copyOf(allowList);
        allowPrefixes = allowPrefixes == null ? List.of() : List.copyOf(allowPrefixes);
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    /**
     * Derives rule settings from a configuration, using the offline release oracle.
     *
     * @param config lint configuration
     * @return settings
     */
    public static RuleSettings from(LintConfig config) {
        return from(config, new KnownReleasesVersionOracle(
            config.versions().knownReleases(), config.versions().minimumWorking()));
    }

    /**
     * Derives rule settings from a configuration with a caller-supplied oracle.
     *
     * @param config lint configuration
     * @param oracle provider version oracle
     * @return settings
     */
    public static RuleSettings from(LintConfig config, ProviderVersionOracle oracle) {
        return new RuleSettings(
            config.naming().instanceName(),
            config.files(),
            config.variables().allowList(),
            config.variables().allowPrefixes(),
            config.versions().providers(),
            oracle
        );
    }

    public static RuleSettings defaults() {
        return from(LintConfig.defaults());
    }

    /**
     * Returns true for variables exempt from the declaration, ordering and usage checks.
     *
     * @param variableName variable name
     * @return true if the name is allow-listed or starts with an allowed prefix
     */
    public boolean isAllowListed(String variableName) {
        return allowList.contains(variableName)
            || allowPrefixes.stream().anyMatch(variableName::startsWith);
    }
}
