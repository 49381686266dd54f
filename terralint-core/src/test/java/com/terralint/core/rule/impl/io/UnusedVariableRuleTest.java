package com.terralint.core.rule.impl.io;

import com.terralint.core.model.Severity;
import com.terralint.core.model.Violation;
import com.terralint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link UnusedVariableRule}.
 */
class UnusedVariableRuleTest extends RuleTestBase {

    @Test
    void check_withUnusedAndSelfReferencingVariables_reportsBoth() throws IOException {
        // Given: self_ref is only referenced in its own validation block
        createFile("main.tf", """
            resource "aws_vpc" "test" {
              tags = {
                Name = var.vpc_name
              }
            }
            """);
        createFile("variables.tf", """
            variable "vpc_name" {
              type = string
            }

            variable "legacy" {
              type = string
            }

            variable "access_key" {
              type = string
            }

            variable "self_ref" {
              type = string

              validation {
                condition     = length(var.self_ref) > 0
                error_message = "Must not be empty."
              }
            }
            """);

        // When
        List<Violation> violations = check(new UnusedVariableRule());

        // Then
        assertThat(violations).extracting(Violation::message).containsExactly(
            "Variable 'legacy' is defined but never used",
            "Variable 'self_ref' is defined but never used");
        assertThat(violations).allSatisfy(v -> assertThat(v.severity()).isEqualTo(Severity.WARNING));
    }

    @Test
    void check_withReferenceInsideHeredoc_countsAsUsage() throws IOException {
        // Given
        createFile("main.tf", """
            resource "aws_instance" "test" {
              user_data = <<EOF
            echo ${var.greeting}
            EOF
            }
            """);
        createFile("variables.tf", """
            variable "greeting" {
              type = string
            }
            """);

        // When / Then
        assertThat(check(new UnusedVariableRule())).isEmpty();
    }
}
