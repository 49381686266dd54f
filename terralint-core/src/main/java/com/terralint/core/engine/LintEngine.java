package com.terralint.core.engine;

import com.terralint.core.model.Severity;
import com.terralint.core.model.SourceFile;
import com.terralint.core.model.ToolDiagnostic;
import com.terralint.core.model.Violation;
import com.terralint.core.parser.BlockExtractor;
import com.terralint.core.parser.ParsedFile;
import com.terralint.core.rule.DirectoryContext;
import com.terralint.core.rule.DirectoryRule;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.FileRule;
import com.terralint.core.rule.LintRule;
import com.terralint.core.rule.RuleDescriptor;
import com.terralint.core.rule.RuleExecutionException;
import com.terralint.core.rule.RuleRegistry;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.suppression.SuppressionMap;
import com.terralint.core.suppression.SuppressionTracker;
import com.terralint.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the selected rules over a set of Terraform files.
 *
 * <p><b>Execution:</b></p>
 * <ol>
 *   <li>Per-file pass, in parallel: read, extract blocks, scan suppression directives and run
 *       every {@link FileRule}.</li>
 *   <li>Directory pass, in parallel per directory: build the directory index and run every
 *       {@link DirectoryRule}.</li>
 *   <li>Merge: violations are ordered by file traversal order, then line, then rule id.
 *       Violations attributed to a directory come before the directory's first file.</li>
 * </ol>
 *
 * <p>Every violation goes through the same sink: the rule's severity unless the rule
 * overrides it, the severity filter, the file's suppression ranges and de-duplication of the
 * same rule on the same file and line. Failures of single rules or files become
 * {@link ToolDiagnostic}s and never abort the run.</p>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Path> files = new SourceDiscovery().discover(root);
 * LintReport report = new LintEngine().run(files, LintOptions.defaults());
 * }</pre>
 *
 * @since 1.0.0
 */
public class LintEngine {

    private static final Logger log = LoggerFactory.getLogger(LintEngine.class);

    private final RuleRegistry registry;
    private final BlockExtractor extractor = new BlockExtractor();
    private final SuppressionTracker suppressionTracker = new SuppressionTracker();

    public LintEngine() {
        this(RuleRegistry.builtIn());
    }

    public LintEngine(RuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Lints the given files.
     *
     * @param files files in traversal order
     * @param options rule selection, parallelism and rule settings
     * @return report with ordered violations and tool diagnostics
     * @throws com.terralint.core.config.ConfigurationException if the options name an unknown
     *         category, rule id or severity
     */
    public LintReport run(List<Path> files, LintOptions options) {
        List<RuleDescriptor> selected = registry.select(
            options.categories(), options.excludedRules(), options.severities());
        Set<Severity> reported = reportedSeverities(options.severities());

        List<FileRule> fileRules = new ArrayList<>();
        List<DirectoryRule> directoryRules = new ArrayList<>();
        for (RuleDescriptor descriptor : selected) {
            if (descriptor.rule() instanceof DirectoryRule directoryRule) {
                directoryRules.add(directoryRule);
            } else if (descriptor.rule() instanceof FileRule fileRule) {
                fileRules.add(fileRule);
            }
        }
        log.info("Linting {} files with {} rules", files.size(), selected.size());

        ExecutorService executor = Executors.newFixedThreadPool(options.effectiveParallelism());
        try {
            List<CompletableFuture<FileResult>> fileFutures = files.stream()
                .map(file -> CompletableFuture.supplyAsync(
                    () -> processFile(file, fileRules, options, reported), executor))
                .toList();
            CompletableFuture.allOf(fileFutures.toArray(new CompletableFuture[0])).join();

            List<FileResult> fileResults = fileFutures.stream().map(CompletableFuture::join).toList();

            Map<Path, SuppressionMap> suppressions = new LinkedHashMap<>();
            Map<Path, List<ParsedFile>> byDirectory = new LinkedHashMap<>();
            for (FileResult result : fileResults) {
                suppressions.put(result.file(), result.suppressions());
                if (result.parsed() != null) {
                    byDirectory.computeIfAbsent(result.parsed().source().directory(), d -> new ArrayList<>())
                        .add(result.parsed());
                }
            }

            List<CompletableFuture<DirectoryResult>> directoryFutures = byDirectory.entrySet().stream()
                .map(entry -> CompletableFuture.supplyAsync(
                    () -> processDirectory(entry.getKey(), entry.getValue(), directoryRules,
                        options, reported, suppressions), executor))
                .toList();
            CompletableFuture.allOf(directoryFutures.toArray(new CompletableFuture[0])).join();

            List<Violation> violations = new ArrayList<>();
            List<ToolDiagnostic> diagnostics = new ArrayList<>();
            fileResults.forEach(r -> {
                violations.addAll(r.violations());
                diagnostics.addAll(r.diagnostics());
            });
            directoryFutures.stream().map(CompletableFuture::join).forEach(r -> {
                violations.addAll(r.violations());
                diagnostics.addAll(r.diagnostics());
            });

            List<Violation> ordered = order(files, violations);
            log.info("Lint finished: {} violations, {} diagnostics", ordered.size(), diagnostics.size());
            return new LintReport(ordered, diagnostics, files.size(), selected);
        } finally {
            executor.shutdown();
        }
    }

    private FileResult processFile(Path file, List<FileRule> rules, LintOptions options, Set<Severity> reported) {
        List<Violation> violations = new ArrayList<>();
        List<ToolDiagnostic> diagnostics = new ArrayList<>();

        String content;
        try {
            content = FileUtils.readString(file);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            diagnostics.add(new ToolDiagnostic(file, null, "Failed to read file: " + e.getMessage()));
            return new FileResult(file, null, SuppressionMap.empty(file), violations, diagnostics);
        }

        SourceFile source = SourceFile.of(file, content);
        ParsedFile parsed = extractor.extract(source);
        SuppressionMap suppressions = suppressionTracker.scan(source);

        for (SuppressionMap.MalformedDirective directive : suppressions.malformed()) {
            log.warn("Ignoring malformed suppression directive in {} at line {}: {}",
                file, directive.line(), directive.text());
            diagnostics.add(new ToolDiagnostic(file, null,
                "Malformed suppression directive at line " + directive.line() + ": " + directive.text()));
        }

        parsed.parseError().ifPresent(error -> {
            log.warn("Could not extract block structure of {} (line {}): {}", file, error.line(), error.message());
            violations.add(Violation.parseError(file, error.message(), error.line()));
        });

        FileContext context = new FileContext(parsed, options.settings());
        Map<Path, SuppressionMap> lookup = Map.of(file, suppressions);
        for (FileRule rule : rules) {
            if (parsed.hasParseError() && rule.requiresStructure()) {
                continue;
            }
            try {
                if (rule.appliesTo(context)) {
                    rule.check(context, new RuleSink(rule, lookup, reported, violations));
                }
            } catch (RuntimeException e) {
                RuleExecutionException failure = new RuleExecutionException(rule.getId(),
                    "Rule " + rule.getId() + " failed on " + file + ": " + e.getMessage(), e);
                log.error(failure.getMessage(), failure);
                diagnostics.add(new ToolDiagnostic(file, rule.getId(), failure.getMessage()));
            }
        }
        return new FileResult(file, parsed, suppressions, violations, diagnostics);
    }

    private DirectoryResult processDirectory(Path directory, List<ParsedFile> files, List<DirectoryRule> rules,
                                             LintOptions options, Set<Severity> reported,
                                             Map<Path, SuppressionMap> suppressions) {
        List<Violation> violations = new ArrayList<>();
        List<ToolDiagnostic> diagnostics = new ArrayList<>();
        DirectoryContext context = DirectoryContext.of(directory, files, options.settings());

        for (DirectoryRule rule : rules) {
            try {
                if (rule.appliesTo(context)) {
                    rule.check(context, new RuleSink(rule, suppressions, reported, violations));
                }
            } catch (RuntimeException e) {
                RuleExecutionException failure = new RuleExecutionException(rule.getId(),
                    "Rule " + rule.getId() + " failed on directory " + directory + ": " + e.getMessage(), e);
                log.error(failure.getMessage(), failure);
                diagnostics.add(new ToolDiagnostic(directory, rule.getId(), failure.getMessage()));
            }
        }
        return new DirectoryResult(violations, diagnostics);
    }

    private static List<Violation> order(List<Path> files, List<Violation> violations) {
        Map<Path, List<Violation>> byTarget = new LinkedHashMap<>();
        for (Violation violation : violations) {
            byTarget.computeIfAbsent(violation.file(), p -> new ArrayList<>()).add(violation);
        }

        List<Violation> ordered = new ArrayList<>(violations.size());
        Set<Path> seenDirectories = new LinkedHashSet<>();
        for (Path file : files) {
            Path directory = file.getParent() != null ? file.getParent() : file;
            if (seenDirectories.add(directory)) {
                drain(byTarget, directory, ordered);
            }
            drain(byTarget, file, ordered);
        }
        for (Path remaining : new ArrayList<>(byTarget.keySet())) {
            drain(byTarget, remaining, ordered);
        }
        return ordered;
    }

    private static void drain(Map<Path, List<Violation>> byTarget, Path target, List<Violation> into) {
        List<Violation> forTarget = byTarget.remove(target);
        if (forTarget != null) {
            forTarget.sort(Violation.BY_LINE_THEN_RULE);
            into.addAll(forTarget);
        }
    }

    private static Set<Severity> reportedSeverities(List<String> names) {
        if (names.isEmpty()) {
            return EnumSet.allOf(Severity.class);
        }
        Set<Severity> result = EnumSet.noneOf(Severity.class);
        names.forEach(name -> result.add(Severity.fromString(name)));
        return result;
    }

    /**
     * Sink bound to one rule invocation. Not shared between threads.
     */
    private static final class RuleSink implements ViolationSink {

        private final LintRule rule;
        private final Map<Path, SuppressionMap> suppressions;
        private final Set<Severity> reported;
        private final List<Violation> into;
        private final Set<String> seen = new HashSet<>();

        RuleSink(LintRule rule, Map<Path, SuppressionMap> suppressions, Set<Severity> reported,
                 List<Violation> into) {
            this.rule = rule;
            this.suppressions = suppressions;
            this.reported = reported;
            this.into = into;
        }

        @Override
        public void report(Path file, int line, String message, Severity severity) {
            Severity effective = severity != null ? severity : rule.getSeverity();
            if (!reported.contains(effective)) {
                return;
            }
            SuppressionMap map = suppressions.get(file);
            if (map != null && map.isSuppressed(rule.getId(), line)) {
                return;
            }
            if (!seen.add(file + ":" + line)) {
                return;
            }
            into.add(new Violation(file, rule.getId(), rule.getCategory(), effective, message, line));
        }
    }

    private record FileResult(
        Path file,
        ParsedFile parsed,
        SuppressionMap suppressions,
        List<Violation> violations,
        List<ToolDiagnostic> diagnostics
    ) {
    }

    private record DirectoryResult(List<Violation> violations, List<ToolDiagnostic> diagnostics) {
    }
}
