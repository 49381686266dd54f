package com.terralint.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Root configuration of a lint run.
 *
 * <p>Loaded from {@code terralint.yaml}. Every section is optional; missing sections and
 * missing keys fall back to the built-in defaults.</p>
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * rules:
 *   categories: [ST, IO]
 *   excluded: [ST.009]
 *
 * paths:
 *   exclude: [examples, legacy]
 *
 * naming:
 *   instanceName: test
 *
 * versions:
 *   providers: [huaweicloud]
 *   knownReleases:
 *     huaweicloud: ["1.60.0", "1.61.0", "1.62.0"]
 *
 * execution:
 *   parallelism: 4
 * }</pre>
 *
 * @param rules rule selection
 * @param paths path filters
 * @param files canonical file names
 * @param naming naming settings
 * @param variables variable allow-list
 * @param versions provider version settings
 * @param execution execution settings
 * @param report report settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LintConfig(
    @JsonProperty("rules") RulesConfig rules,
    @JsonProperty("paths") PathsConfig paths,
    @JsonProperty("files") FilesConfig files,
    @JsonProperty("naming") NamingConfig naming,
    @JsonProperty("variables") VariablesConfig variables,
    @JsonProperty("versions") VersionsConfig versions,
    @JsonProperty("execution") ExecutionConfig execution,
    @JsonProperty("report") ReportConfig report
) {
    /**
     * Compact constructor filling in missing sections.
     */
    public LintConfig {
        rules = rules != null ? rules : new RulesConfig(null, null, null);
        paths = paths != null ? paths : new PathsConfig(null, null);
        files = files != null ? files : new FilesConfig(null, null, null, null, null);
        naming = naming != null ? naming : new NamingConfig(null);
        variables = variables != null ? variables : new VariablesConfig(null, null);
        versions = versions != null ? versions : new VersionsConfig(null, null, null);
        execution = execution != null ? execution : new ExecutionConfig(null);
        report = report != null ? report : new ReportConfig(null, null);
    }

    /**
     * Creates the default configuration: every rule of every category, canonical file names
     * and the built-in allow-list.
     *
     * @return default configuration
     */
    public static LintConfig defaults() {
        return new LintConfig(null, null, null, null, null, null, null, null);
    }

    /**
     * Rule selection.
     *
     * @param categories category codes to run, empty for all
     * @param excluded rule ids to skip
     * @param severities severities to keep, empty for all
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RulesConfig(
        @JsonProperty("categories") List<String> categories,
        @JsonProperty("excluded") List<String> excluded,
        @JsonProperty("severities") List<String> severities
    ) {
        public RulesConfig {
            categories = categories != null ? List.copyOf(categories) : List.of();
            excluded = excluded != null ? List.copyOf(excluded) : List.of();
            severities = severities != null ? List.copyOf(severities) : List.of();
        }
    }

    /**
     * Path filters relative to the lint root.
     *
     * @param include globs a file must match, empty for all
     * @param exclude globs or directory names to skip
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PathsConfig(
        @JsonProperty("include") List<String> include,
        @JsonProperty("exclude") List<String> exclude
    ) {
        public PathsConfig {
            include = include != null ? List.copyOf(include) : List.of();
            exclude = exclude != null ? List.copyOf(exclude) : List.of();
        }
    }

    /**
     * Canonical file names of a Terraform module directory.
     *
     * @param main main configuration file
     * @param variables variable definitions file
     * @param outputs output definitions file
     * @param providers provider and terraform settings file
     * @param tfvars variable values file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FilesConfig(
        @JsonProperty("main") String main,
        @JsonProperty("variables") String variables,
        @JsonProperty("outputs") String outputs,
        @JsonProperty("providers") String providers,
        @JsonProperty("tfvars") String tfvars
    ) {
        public FilesConfig {
            main = main != null ? main : "main.tf";
            variables = variables != null ? variables : "variables.tf";
            outputs = outputs != null ? outputs : "outputs.tf";
            providers = providers != null ? providers : "providers.tf";
            tfvars = tfvars != null ? tfvars : "terraform.tfvars";
        }
    }

    /**
     * @param instanceName required instance label of resource and data blocks
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NamingConfig(
        @JsonProperty("instanceName") String instanceName
    ) {
        public NamingConfig {
            instanceName = instanceName != null ? instanceName : "test";
        }
    }

    /**
     * Variables exempt from the required-declaration, ordering and unused checks.
     *
     * @param allowList exact names
     * @param allowPrefixes name prefixes
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VariablesConfig(
        @JsonProperty("allowList") List<String> allowList,
        @JsonProperty("allowPrefixes") List<String> allowPrefixes
    ) {
        /** Authentication and tenancy variables normally supplied by the environment. */
        public static final List<String> DEFAULT_ALLOW_LIST = List.of(
            "access_key", "secret_key", "domain_name", "tenant_name", "tenant_id",
            "user_name", "user_id", "project_name", "project_id");

        public static final List<String> DEFAULT_ALLOW_PREFIXES = List.of("region");

        public VariablesConfig {
            allowList = allowList != null ? List.copyOf(allowList) : DEFAULT_ALLOW_LIST;
            allowPrefixes = allowPrefixes != null ? List.copyOf(allowPrefixes) : DEFAULT_ALLOW_PREFIXES;
        }
    }

    /**
     * Provider version settings used by the provider version check.
     *
     * @param providers provider names whose {@code required_providers} constraints are checked;
     *        defaults to the providers that have known releases
     * @param knownReleases released versions per provider
     * @param minimumWorking lowest release per provider known to work with the configuration
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VersionsConfig(
        @JsonProperty("providers") List<String> providers,
        @JsonProperty("knownReleases") Map<String, List<String>> knownReleases,
        @JsonProperty("minimumWorking") Map<String, String> minimumWorking
    ) {
        public VersionsConfig {
            knownReleases = knownReleases != null ? Map.copyOf(knownReleases) : Map.of();
            providers = providers != null ? List.copyOf(providers) : knownReleases.keySet().stream().sorted().toList();
            minimumWorking = minimumWorking != null ? Map.copyOf(minimumWorking) : Map.of();
        }
    }

    /**
     * @param parallelism worker threads for per-file processing, 0 for the number of processors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExecutionConfig(
        @JsonProperty("parallelism") Integer parallelism
    ) {
        public ExecutionConfig {
            parallelism = parallelism != null ? parallelism : 0;
        }
    }

    /**
     * @param format {@code text}, {@code json} or {@code both}
     * @param directory directory the report files are written to, null for none
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportConfig(
        @JsonProperty("format") String format,
        @JsonProperty("directory") String directory
    ) {
        public ReportConfig {
            format = format != null ? format : "text";
        }
    }
}
