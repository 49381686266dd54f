package com.terralint.core.rule;

import com.terralint.core.engine.LintEngine;
import com.terralint.core.engine.LintOptions;
import com.terralint.core.engine.LintReport;
import com.terralint.core.engine.SourceDiscovery;
import com.terralint.core.model.Violation;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Base class for rule functional tests.
 *
 * <p>Provides common test infrastructure including:
 * <ul>
 *   <li>Temporary directory creation for test configurations</li>
 *   <li>Helper methods for creating Terraform files</li>
 *   <li>Running a single rule through the real engine, so suppression and
 *       de-duplication behave as in a full run</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract class RuleTestBase {

    @TempDir
    protected Path tempDir;

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "main.tf" or "modules/vpc/main.tf")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    protected Path createDirectory(String relativePath) throws IOException {
        return Files.createDirectories(tempDir.resolve(relativePath));
    }

    /**
     * Runs one rule with default settings over every Terraform file in the temp directory.
     *
     * @param rule rule under test
     * @return full report, including parse errors and diagnostics
     * @throws IOException if the temp directory cannot be walked
     */
    protected LintReport lint(LintRule rule) throws IOException {
        return lint(rule, RuleSettings.defaults());
    }

    protected LintReport lint(LintRule rule, RuleSettings settings) throws IOException {
        RuleRegistry registry = new RuleRegistry();
        registry.register(rule);
        List<Path> files = new SourceDiscovery().discover(tempDir);
        LintOptions options = new LintOptions(List.of(), List.of(), List.of(), 1, settings);
        return new LintEngine(registry).run(files, options);
    }

    /**
     * Runs one rule and returns only that rule's violations.
     *
     * @param rule rule under test
     * @return violations in report order
     * @throws IOException if the temp directory cannot be walked
     */
    protected List<Violation> check(LintRule rule) throws IOException {
        return check(rule, RuleSettings.defaults());
    }

    protected List<Violation> check(LintRule rule, RuleSettings settings) throws IOException {
        return lint(rule, settings).violations().stream()
            .filter(v -> v.ruleId().equals(rule.getId()))
            .toList();
    }

    protected static List<Integer> lines(List<Violation> violations) {
        return violations.stream().map(Violation::line).toList();
    }
}
