package com.terralint.core.report;

import com.terralint.core.engine.LintReport;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.model.Violation;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Plain-text report: summary, counts per category, then every violation twice, once in the
 * detailed format with the full path and once in the short {@code file:line} format.
 *
 * <p>Sections without entries are left out.</p>
 */
public class TextReportRenderer implements ReportRenderer {

    public static final String FILE_NAME = "terralint-report.txt";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(60);

    private final Clock clock;

    public TextReportRenderer() {
        this(Clock.systemDefaultZone());
    }

    public TextReportRenderer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String fileName() {
        return FILE_NAME;
    }

    @Override
    public String render(LintReport report) {
        List<Violation> errors = report.violations().stream().filter(v -> v.severity() == Severity.ERROR).toList();
        List<Violation> warnings = report.violations().stream().filter(v -> v.severity() == Severity.WARNING).toList();

        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n');
        out.append("TERRAFORM LINT REPORT").append('\n');
        out.append(RULE).append('\n');
        out.append("Generated: ").append(LocalDateTime.now(clock).format(TIMESTAMP)).append("\n\n");

        out.append("=== SUMMARY ===\n");
        out.append("Total Errors: ").append(errors.size()).append('\n');
        out.append("Total Warnings: ").append(warnings.size()).append('\n');
        out.append("Total Violations: ").append(report.violations().size()).append('\n');
        out.append("Files Processed: ").append(report.filesScanned()).append('\n');
        out.append("Rules Executed: ").append(report.rules().size()).append("\n\n");

        if (report.hasViolations()) {
            out.append("=== VIOLATIONS BY CATEGORY ===\n");
            for (RuleCategory category : RuleCategory.values()) {
                long total = count(report, category, null);
                out.append(category.name()).append(" (").append(category.displayName()).append("): ")
                    .append(total).append(" violations, ")
                    .append(count(report, category, Severity.ERROR)).append(" errors, ")
                    .append(count(report, category, Severity.WARNING)).append(" warnings\n");
            }
            out.append('\n');
        }

        section(out, "DETAILED ERRORS", errors, ViolationFormat::detailed);
        section(out, "DETAILED WARNINGS", warnings, ViolationFormat::detailed);
        section(out, "SUMMARY ERRORS (FILE:LINE)", errors, ViolationFormat::summary);
        section(out, "SUMMARY WARNINGS (FILE:LINE)", warnings, ViolationFormat::summary);
        section(out, "TOOL DIAGNOSTICS", report.diagnostics(), ViolationFormat::diagnostic);
        return out.toString();
    }

    private static long count(LintReport report, RuleCategory category, Severity severity) {
        return report.violations().stream()
            .filter(v -> v.category() == category)
            .filter(v -> severity == null || v.severity() == severity)
            .count();
    }

    private static <T> void section(StringBuilder out, String title, List<T> entries, Function<T, String> format) {
        if (entries.isEmpty()) {
            return;
        }
        out.append("=== ").append(title).append(" ===\n");
        for (T entry : entries) {
            out.append("  ").append(format.apply(entry)).append('\n');
        }
        out.append('\n');
    }
}
