package com.terralint.core.report;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TextReportRenderer}.
 */
class TextReportRendererTest {

    private final TextReportRenderer renderer = new TextReportRenderer(ReportFixtures.CLOCK);

    @Test
    void render_writesSummaryAndCategoryCounts() {
        // When
        String text = renderer.render(ReportFixtures.sample());

        // Then
        assertThat(text)
            .contains("TERRAFORM LINT REPORT")
            .contains("Generated: 2026-01-15 10:30:00")
            .contains("""
                === SUMMARY ===
                Total Errors: 1
                Total Warnings: 2
                Total Violations: 3
                Files Processed: 2
                Rules Executed: 3
                """)
            .contains("ST (Style/Format): 2 violations, 1 errors, 1 warnings")
            .contains("IO (Input/Output): 1 violations, 0 errors, 1 warnings")
            .contains("SC (Security Code): 0 violations, 0 errors, 0 warnings");
    }

    @Test
    void render_writesDetailedBeforeSummarySections() {
        // When
        String text = renderer.render(ReportFixtures.sample());

        // Then
        assertThat(text).containsSubsequence(
            "=== DETAILED ERRORS ===",
            "  ERROR: ",
            "=== DETAILED WARNINGS ===",
            "=== SUMMARY ERRORS (FILE:LINE) ===",
            "  main.tf:3 [ST.001]",
            "=== SUMMARY WARNINGS (FILE:LINE) ===",
            "  stack_one [ST.013]",
            "  variables.tf:5 [IO.009]",
            "=== TOOL DIAGNOSTICS ===",
            "Malformed suppression directive at line 1");
    }

    @Test
    void render_cleanReport_omitsEmptySections() {
        // When
        String text = renderer.render(ReportFixtures.clean());

        // Then
        assertThat(text)
            .contains("Total Violations: 0")
            .contains("Files Processed: 4")
            .doesNotContain("=== VIOLATIONS BY CATEGORY ===")
            .doesNotContain("=== DETAILED ERRORS ===")
            .doesNotContain("=== TOOL DIAGNOSTICS ===");
    }
}
