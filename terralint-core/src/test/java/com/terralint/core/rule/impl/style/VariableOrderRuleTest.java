package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Severity;
import com.terralint.core.model.Violation;
import com.terralint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link VariableOrderRule}.
 */
class VariableOrderRuleTest extends RuleTestBase {

    private final VariableOrderRule rule = new VariableOrderRule();

    private static final String MAIN = """
        resource "aws_instance" "test" {
          ami           = var.ami
          instance_type = var.size
          subnet_id     = var.subnet
        }
        """;

    @Test
    void check_withSwappedDefinitions_reportsVariableOutsideCommonOrder() throws IOException {
        // Given: size is defined before ami although main.tf uses ami first
        createFile("main.tf", MAIN);
        createFile("variables.tf", """
            variable "size" {
              type = string
            }

            variable "ami" {
              type = string
            }

            variable "subnet" {
              type = string
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(violations).hasSize(1);
        Violation violation = violations.get(0);
        assertThat(violation.file().getFileName().toString()).isEqualTo("variables.tf");
        assertThat(violation.line()).isEqualTo(5);
        assertThat(violation.severity()).isEqualTo(Severity.WARNING);
        assertThat(violation.message()).isEqualTo("Variable 'ami' is not in the correct order. "
            + "Expected order: ami, size, subnet. Current order: size, ami, subnet");
    }

    @Test
    void check_withMatchingOrder_reportsNothing() throws IOException {
        // Given
        createFile("main.tf", MAIN);
        createFile("variables.tf", """
            variable "ami" {
              type = string
            }

            variable "size" {
              type = string
            }

            variable "subnet" {
              type = string
            }

            variable "unused" {
              type = string
            }
            """);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }

    @Test
    void check_withoutVariablesFile_doesNotApply() throws IOException {
        // Given
        createFile("main.tf", MAIN);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }

    @Test
    void longestCommonSubsequence_keepsRelativeOrder() {
        // When
        List<String> lcs = VariableOrderRule.longestCommonSubsequence(
            List.of("a", "b", "c", "d"), List.of("b", "a", "c", "d"));

        // Then
        assertThat(lcs).hasSize(3).endsWith("c", "d");
    }
}
