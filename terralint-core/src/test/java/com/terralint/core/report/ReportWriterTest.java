package com.terralint.core.report;

import com.terralint.core.config.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ReportWriter} and {@link ReportFormat}.
 */
class ReportWriterTest {

    @TempDir
    Path tempDir;

    private final ReportWriter writer = new ReportWriter(
        new TextReportRenderer(ReportFixtures.CLOCK), new JsonReportRenderer(ReportFixtures.CLOCK));

    @Test
    void write_withBothFormats_createsDirectoryAndBothFiles() throws IOException {
        // Given
        Path reports = tempDir.resolve("out/reports");

        // When
        List<Path> written = writer.write(ReportFixtures.sample(), ReportFormat.BOTH, reports);

        // Then
        assertThat(written).containsExactly(
            reports.resolve(TextReportRenderer.FILE_NAME), reports.resolve(JsonReportRenderer.FILE_NAME));
        assertThat(Files.readString(written.get(0))).startsWith("=".repeat(60));
        assertThat(Files.readString(written.get(1))).startsWith("{");
    }

    @Test
    void write_withJsonFormat_writesOnlyJson() {
        // When
        List<Path> written = writer.write(ReportFixtures.clean(), ReportFormat.JSON, tempDir);

        // Then
        assertThat(written).extracting(p -> p.getFileName().toString())
            .containsExactly(JsonReportRenderer.FILE_NAME);
    }

    @Test
    void fromString_acceptsAnyCase() {
        assertThat(ReportFormat.fromString(" Both ")).isEqualTo(ReportFormat.BOTH);
        assertThat(ReportFormat.TEXT.includesJson()).isFalse();
        assertThat(ReportFormat.BOTH.includesText()).isTrue();
    }

    @Test
    void fromString_withUnknownFormat_throwsConfigurationException() {
        assertThatThrownBy(() -> ReportFormat.fromString("xml"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("Unknown report format: 'xml' (expected text, json or both)");
    }
}
