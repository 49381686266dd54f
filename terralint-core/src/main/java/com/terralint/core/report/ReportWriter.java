package com.terralint.core.report;

import com.terralint.core.engine.LintReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes report files into a directory, one per renderer selected by the {@link ReportFormat}.
 *
 * <p>Creates the directory when needed and overwrites existing reports.</p>
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final TextReportRenderer textRenderer;
    private final JsonReportRenderer jsonRenderer;

    public ReportWriter() {
        this(new TextReportRenderer(), new JsonReportRenderer());
    }

    public ReportWriter(TextReportRenderer textRenderer, JsonReportRenderer jsonRenderer) {
        this.textRenderer = textRenderer;
        this.jsonRenderer = jsonRenderer;
    }

    /**
     * Renders and writes the report files.
     *
     * @param report lint result
     * @param format which files to write
     * @param directory target directory
     * @return written files
     * @throws IllegalStateException if a file cannot be written
     */
    public List<Path> write(LintReport report, ReportFormat format, Path directory) {
        List<ReportRenderer> renderers = new ArrayList<>();
        if (format.includesText()) {
            renderers.add(textRenderer);
        }
        if (format.includesJson()) {
            renderers.add(jsonRenderer);
        }

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create report directory: " + directory, e);
        }

        List<Path> written = new ArrayList<>();
        for (ReportRenderer renderer : renderers) {
            Path target = directory.resolve(renderer.fileName());
            try {
                Files.writeString(target, renderer.render(report));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to write report: " + target, e);
            }
            log.info("Wrote {} report: {}", renderer.getId(), target);
            written.add(target);
        }
        return written;
    }
}
