package com.terralint.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JsonReportRenderer}.
 */
class JsonReportRendererTest {

    private final JsonReportRenderer renderer = new JsonReportRenderer(ReportFixtures.CLOCK);
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void render_writesMetadataAndSummary() throws IOException {
        // When
        JsonNode root = objectMapper.readTree(renderer.render(ReportFixtures.sample()));

        // Then
        assertThat(root.path("metadata").path("generated").asText()).isEqualTo("2026-01-15T10:30Z");
        assertThat(root.path("metadata").path("format_version").asText()).isEqualTo("1.0.0");
        assertThat(root.path("summary").path("total_errors").asInt()).isEqualTo(1);
        assertThat(root.path("summary").path("total_warnings").asInt()).isEqualTo(2);
        assertThat(root.path("summary").path("total_violations").asInt()).isEqualTo(3);
        assertThat(root.path("summary").path("files_processed").asInt()).isEqualTo(2);
        assertThat(root.path("summary").path("tool_diagnostics").asInt()).isEqualTo(1);
        assertThat(root.path("violations_by_category").path("ST").path("warnings").asInt()).isEqualTo(1);
        assertThat(root.path("violations_by_category").path("DC").path("violations").asInt()).isZero();
    }

    @Test
    void render_writesViolationsWithNullLineForDirectoryViolations() throws IOException {
        // When
        JsonNode violations = objectMapper.readTree(renderer.render(ReportFixtures.sample())).path("violations");

        // Then
        assertThat(violations).hasSize(3);
        JsonNode first = violations.get(0);
        assertThat(first.path("rule_id").asText()).isEqualTo("ST.001");
        assertThat(first.path("line").asInt()).isEqualTo(3);
        assertThat(first.path("severity").asText()).isEqualTo("error");
        assertThat(first.path("category").asText()).isEqualTo("ST");
        assertThat(violations.get(1).path("line").isNull()).isTrue();
        assertThat(violations.get(1).path("severity").asText()).isEqualTo("warning");
    }

    @Test
    void render_writesRulesSystem() throws IOException {
        // When
        JsonNode rules = objectMapper.readTree(renderer.render(ReportFixtures.sample())).path("rules_system");

        // Then
        assertThat(rules.path("total_executed_rules").asInt()).isEqualTo(3);
        assertThat(rules.path("active_categories")).extracting(JsonNode::asText).containsExactly("ST", "IO");
        assertThat(rules.path("executed_rules")).extracting(JsonNode::asText)
            .containsExactly("ST.001", "ST.013", "IO.009");
    }
}
