package com.terralint.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.terralint.core.engine.LintReport;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.model.ToolDiagnostic;
import com.terralint.core.model.Violation;
import com.terralint.core.rule.RuleDescriptor;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * JSON report, pretty printed.
 *
 * <p><b>Top-level keys:</b> {@code metadata}, {@code summary}, {@code violations_by_category},
 * {@code violations}, {@code diagnostics} and {@code rules_system}. Violations without a line
 * carry {@code "line": null}.</p>
 */
public class JsonReportRenderer implements ReportRenderer {

    public static final String FILE_NAME = "terralint-report.json";

    static final String FORMAT_VERSION = "1.0.0";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;

    public JsonReportRenderer() {
        this(Clock.systemDefaultZone());
    }

    public JsonReportRenderer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String fileName() {
        return FILE_NAME;
    }

    @Override
    public String render(LintReport report) {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("generated", OffsetDateTime.now(clock).toString());
        metadata.put("format_version", FORMAT_VERSION);
        metadata.put("report_format", "json");

        ObjectNode summary = root.putObject("summary");
        summary.put("total_errors", report.errorCount());
        summary.put("total_warnings", report.warningCount());
        summary.put("total_violations", report.violations().size());
        summary.put("files_processed", report.filesScanned());
        summary.put("tool_diagnostics", report.diagnostics().size());

        ObjectNode byCategory = root.putObject("violations_by_category");
        for (RuleCategory category : RuleCategory.values()) {
            ObjectNode node = byCategory.putObject(category.name());
            node.put("violations", report.violations().stream().filter(v -> v.category() == category).count());
            node.put("errors", report.violations().stream()
                .filter(v -> v.category() == category && v.severity() == Severity.ERROR).count());
            node.put("warnings", report.violations().stream()
                .filter(v -> v.category() == category && v.severity() == Severity.WARNING).count());
        }

        ArrayNode violations = root.putArray("violations");
        for (Violation violation : report.violations()) {
            ObjectNode node = violations.addObject();
            node.put("file", violation.file().toString());
            if (violation.hasLine()) {
                node.put("line", violation.line());
            } else {
                node.putNull("line");
            }
            node.put("rule_id", violation.ruleId());
            node.put("category", violation.category().name());
            node.put("severity", violation.severity().label());
            node.put("message", violation.message());
        }

        ArrayNode diagnostics = root.putArray("diagnostics");
        for (ToolDiagnostic diagnostic : report.diagnostics()) {
            ObjectNode node = diagnostics.addObject();
            node.put("file", diagnostic.file().toString());
            node.put("rule_id", diagnostic.ruleId());
            node.put("message", diagnostic.message());
        }

        ObjectNode rulesSystem = root.putObject("rules_system");
        rulesSystem.put("total_executed_rules", report.rules().size());
        ArrayNode categories = rulesSystem.putArray("active_categories");
        report.rules().stream().map(d -> d.category().name()).distinct().forEach(categories::add);
        ArrayNode ruleIds = rulesSystem.putArray("executed_rules");
        report.rules().stream().map(RuleDescriptor::id).forEach(ruleIds::add);

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize lint report", e);
        }
    }
}
