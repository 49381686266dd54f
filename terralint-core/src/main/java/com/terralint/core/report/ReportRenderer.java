package com.terralint.core.report;

import com.terralint.core.engine.LintReport;

/**
 * Renders a {@link LintReport} into the content of one report file.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CsvReportRenderer implements ReportRenderer {
 *     public String getId() { return "csv"; }
 *     public String fileName() { return "terralint-report.csv"; }
 *     public String render(LintReport report) { ... }
 * }
 * }</pre>
 *
 * @see ReportWriter
 */
public interface ReportRenderer {

    /**
     * Returns the unique identifier of this renderer, e.g. {@code text} or {@code json}.
     *
     * @return renderer id
     */
    String getId();

    /**
     * Name of the file the rendered content is written to.
     *
     * @return file name
     */
    String fileName();

    /**
     * Renders the report.
     *
     * @param report lint result
     * @return file content
     */
    String render(LintReport report);
}
