package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Violation;
import com.terralint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link DataSourceVariableDefaultRule}.
 */
class DataSourceVariableDefaultRuleTest extends RuleTestBase {

    private final DataSourceVariableDefaultRule rule = new DataSourceVariableDefaultRule();

    @Test
    void check_withVariableWithoutDefault_reportsReference() throws IOException {
        // Given: name_regex has no default, ami_owner has one
        createFile("main.tf", """
            data "aws_ami" "test" {
              owners     = [var.ami_owner]
              name_regex = var.name_regex
            }
            """);
        createFile("variables.tf", """
            variable "ami_owner" {
              default = "self"
            }

            variable "name_regex" {
              type = string
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).file().getFileName().toString()).isEqualTo("main.tf");
        assertThat(violations.get(0).line()).isEqualTo(3);
        assertThat(violations.get(0).message())
            .isEqualTo("Variable 'name_regex' used in data source must have a default value");
    }

    @Test
    void check_withUndefinedVariable_reportsMissingDefinition() throws IOException {
        // Given
        createFile("main.tf", """
            data "aws_ami" "test" {
              name_regex = var.missing
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(violations).extracting(Violation::message)
            .containsExactly("Variable 'missing' used in data source is not defined in the current directory");
    }

    @Test
    void check_withRepeatedReference_reportsFirstOnly() throws IOException {
        // Given: the same variable twice inside one data block
        createFile("main.tf", """
            data "aws_ami" "test" {
              owners     = [var.owner]
              name_regex = var.owner
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(lines(violations)).containsExactly(2);
    }

    @Test
    void check_withReferenceInResource_ignoresIt() throws IOException {
        // Given: var.size is used by a resource, not a data source
        createFile("main.tf", """
            resource "aws_instance" "test" {
              instance_type = var.size
            }
            """);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }
}
