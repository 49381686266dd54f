package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Violation;
import com.terralint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Functional tests for the blank-line rules {@link BlockSpacingRule},
 * {@link SameGroupSpacingRule} and {@link DifferentGroupSpacingRule}.
 */
class SpacingRulesTest extends RuleTestBase {

    @Test
    void blockSpacing_withMissingAndExtraBlankLines_reportsBoth() throws IOException {
        // Given: no blank line before the subnet, three before the output
        createFile("main.tf", """
            resource "aws_vpc" "test" {
              cidr_block = "10.0.0.0/16"
            }
            resource "aws_subnet" "test" {
              vpc_id = aws_vpc.test.id
            }



            output "vpc_id" {
              value = aws_vpc.test.id
            }
            """);

        // When
        List<Violation> violations = check(new BlockSpacingRule());

        // Then: missing at the second block, surplus at the second blank line
        assertThat(violations).extracting(Violation::line, Violation::message).containsExactly(
            tuple(4, "Missing blank line between resource 'aws_vpc' and resource 'aws_subnet', "
                + "the number of blank line should be 1."),
            tuple(8, "Too many blank lines between resource 'aws_subnet' and output 'vpc_id', "
                + "the number of blank line should be 1."));
    }

    @Test
    void blockSpacing_withCommentBetweenBlocks_doesNotCountCommentAsBlank() throws IOException {
        // Given
        createFile("main.tf", """
            locals {
              name = "web"
            }

            # Network
            resource "aws_vpc" "test" {
              cidr_block = "10.0.0.0/16"
            }
            """);

        // When / Then
        assertThat(check(new BlockSpacingRule())).isEmpty();
    }

    @Test
    void sameGroupSpacing_withTwoBlankLinesBetweenBasicParameters_reports() throws IOException {
        // Given
        createFile("main.tf", """
            resource "aws_instance" "test" {
              ami = "ami-123"


              instance_type = "t3.micro"
            }
            """);

        // When
        List<Violation> violations = check(new SameGroupSpacingRule());

        // Then
        assertThat(violations).extracting(Violation::line, Violation::message).containsExactly(
            tuple(5, "Found 2 blank lines between basic parameter 'ami' and basic parameter 'instance_type'. "
                + "0 or 1 blank line is recommended."));
    }

    @Test
    void sameGroupSpacing_withTfvarsAssignments_checksRootParameters() throws IOException {
        // Given
        createFile("terraform.tfvars", """
            vpc_name = "web"


            subnet_name = "web-a"
            """);

        // When
        List<Violation> violations = check(new SameGroupSpacingRule());

        // Then
        assertThat(lines(violations)).containsExactly(4);
    }

    @Test
    void differentGroupSpacing_withMetaArgumentNextToBasicParameter_reportsMissingBlankLine() throws IOException {
        // Given
        createFile("main.tf", """
            resource "aws_instance" "test" {
              count = 2
              ami   = "ami-123"

              tags = {
                Name = "web"
              }
            }
            """);

        // When
        List<Violation> violations = check(new DifferentGroupSpacingRule());

        // Then
        assertThat(violations).extracting(Violation::line, Violation::message).containsExactly(
            tuple(3, "Missing blank line between meta-argument and basic parameter 'count' and 'ami' "
                + "in resource \"aws_instance\" \"test\" (1 blank line is expected)"));
    }

    @Test
    void differentGroupSpacing_withBlockDirectlyAfterParameter_reportsParameterBlockPair() throws IOException {
        // Given
        createFile("main.tf", """
            resource "aws_security_group" "test" {
              name = "web"
              ingress {
                from_port = 80
              }
            }
            """);

        // When
        List<Violation> violations = check(new DifferentGroupSpacingRule());

        // Then
        assertThat(violations).extracting(Violation::message).containsExactly(
            "Missing blank line between basic parameter and parameter block 'name' and 'ingress' "
                + "in resource \"aws_security_group\" \"test\" (1 blank line is expected)");
    }

    @Test
    void differentGroupSpacing_withVariableBlock_isExempt() throws IOException {
        // Given
        createFile("variables.tf", """
            variable "name" {
              type    = string
              default = "web"
              validation {
                condition     = length(var.name) > 0
                error_message = "Name must not be empty."
              }
            }
            """);

        // When / Then
        assertThat(check(new DifferentGroupSpacingRule())).isEmpty();
    }
}
