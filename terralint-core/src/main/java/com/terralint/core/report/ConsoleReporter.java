package com.terralint.core.report;

import com.terralint.core.engine.LintReport;
import com.terralint.core.model.ToolDiagnostic;
import com.terralint.core.model.Violation;

import java.io.PrintWriter;
import java.util.Objects;

/**
 * Prints violations and a one-line summary to a terminal, with optional ANSI colours.
 *
 * <p>Colours are usually disabled in CI or when output is redirected.</p>
 */
public class ConsoleReporter {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private final PrintWriter out;
    private final boolean useColors;

    public ConsoleReporter(PrintWriter out, boolean useColors) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.useColors = useColors;
    }

    /**
     * Prints every violation, the tool diagnostics and the totals.
     *
     * @param report lint result
     */
    public void print(LintReport report) {
        for (Violation violation : report.violations()) {
            String color = violation.isError() ? ANSI_RED : ANSI_YELLOW;
            out.println(paint(color, ViolationFormat.detailed(violation)));
        }
        for (ToolDiagnostic diagnostic : report.diagnostics()) {
            out.println(paint(ANSI_CYAN, "NOTE: " + ViolationFormat.diagnostic(diagnostic)));
        }
        if (report.hasViolations() || !report.diagnostics().isEmpty()) {
            out.println();
        }

        String totals = report.filesScanned() + " file(s) checked, "
            + report.errorCount() + " error(s), " + report.warningCount() + " warning(s)";
        if (report.hasErrors()) {
            out.println(paint(ANSI_BOLD + ANSI_RED, "✗ " + totals));
        } else if (report.hasViolations()) {
            out.println(paint(ANSI_BOLD + ANSI_YELLOW, "✓ " + totals));
        } else {
            out.println(paint(ANSI_BOLD + ANSI_GREEN, "✓ " + totals));
        }
        out.flush();
    }

    private String paint(String color, String text) {
        return useColors ? color + text + ANSI_RESET : text;
    }
}
