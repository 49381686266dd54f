package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Violation;
import com.terralint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Functional tests for {@link QuoteUsageRule}.
 */
class QuoteUsageRuleTest extends RuleTestBase {

    private final QuoteUsageRule rule = new QuoteUsageRule();

    @Test
    void check_withUnquotedLabels_reportsEachBlock() throws IOException {
        // Given
        createFile("main.tf", """
            resource aws_vpc test {
              cidr_block = "10.0.0.0/16"
            }

            variable name {
              type = string
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(violations).extracting(Violation::message).containsExactly(
            "Resource type and name must be enclosed in double quotes",
            "Variable name must be enclosed in double quotes");
    }

    @Test
    void check_withUnquotedDynamicLabel_reportsDynamicBlock() throws IOException {
        // Given
        createFile("main.tf", """
            resource "aws_security_group" "test" {
              dynamic ingress {
                for_each = var.ports
                content {
                  from_port = ingress.value
                }
              }
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(violations).extracting(Violation::line, Violation::message)
            .containsExactly(tuple(2,
                "Dynamic block label 'ingress' must be enclosed in double quotes"));
    }

    @Test
    void check_withQuotedLabels_reportsNothing() throws IOException {
        // Given
        createFile("main.tf", """
            resource "aws_vpc" "test" {
              cidr_block = "10.0.0.0/16"
            }
            """);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }
}
