package com.terralint.core.engine;

import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.model.ToolDiagnostic;
import com.terralint.core.model.Violation;
import com.terralint.core.rule.RuleDescriptor;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a lint run.
 *
 * @param violations violations in report order: file traversal order, then line, then rule id
 * @param diagnostics problems of the tool itself (unreadable files, failing rules, malformed directives)
 * @param filesScanned number of files processed
 * @param rules rules that ran
 */
public record LintReport(
    List<Violation> violations,
    List<ToolDiagnostic> diagnostics,
    int filesScanned,
    List<RuleDescriptor> rules
) {
    /**
     * Compact constructor with validation.
     */
    public LintReport {
        violations = violations == null ? List.of() : List.copyOf(violations);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public long errorCount() {
        return count(Severity.ERROR);
    }

    public long warningCount() {
        return count(Severity.WARNING);
    }

    private long count(Severity severity) {
        return violations.stream().filter(v -> v.severity() == severity).count();
    }

    /**
     * Returns true when at least one violation has error severity.
     *
     * @return true if the run found errors
     */
    public boolean hasErrors() {
        return violations.stream().anyMatch(Violation::isError);
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }

    /**
     * Counts violations per category. Every category is present, with 0 when it has none.
     *
     * @return counts in category order
     */
    public Map<RuleCategory, Long> countsByCategory() {
        Map<RuleCategory, Long> counts = new EnumMap<>(RuleCategory.class);
        for (RuleCategory category : RuleCategory.values()) {
            counts.put(category, 0L);
        }
        violations.forEach(v -> counts.merge(v.category(), 1L, Long::sum));
        return counts;
    }

    public List<Violation> violationsFor(Path file) {
        return violations.stream().filter(v -> v.file().equals(file)).toList();
    }
}
