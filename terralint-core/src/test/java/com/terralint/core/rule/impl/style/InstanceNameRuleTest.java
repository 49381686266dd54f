package com.terralint.core.rule.impl.style;

import com.terralint.core.config.LintConfig;
import com.terralint.core.model.Violation;
import com.terralint.core.rule.RuleSettings;
import com.terralint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link InstanceNameRule}.
 */
class InstanceNameRuleTest extends RuleTestBase {

    private final InstanceNameRule rule = new InstanceNameRule();

    @Test
    void check_withWrongResourceName_reportsHeaderLine() throws IOException {
        // Given: one resource named "main" and one data source named "test"
        createFile("main.tf", """
            resource "aws_vpc" "main" {
              cidr_block = "10.0.0.0/16"
            }

            data "aws_ami" "test" {
              most_recent = true
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then: only the resource is reported, on its header line
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).line()).isEqualTo(1);
        assertThat(violations.get(0).message())
            .isEqualTo("Resource 'aws_vpc' instance name 'main' should be 'test'");
    }

    @Test
    void check_withWrongDataSourceName_usesDataSourceNoun() throws IOException {
        // Given
        createFile("main.tf", """
            data "aws_ami" "ubuntu" {
              most_recent = true
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(violations).extracting(Violation::message)
            .containsExactly("Data source 'aws_ami' instance name 'ubuntu' should be 'test'");
    }

    @Test
    void check_withConfiguredInstanceName_acceptsThatName() throws IOException {
        // Given: the configuration expects "this"
        createFile("main.tf", """
            resource "aws_vpc" "this" {
              cidr_block = "10.0.0.0/16"
            }
            """);
        LintConfig config = new LintConfig(null, null, null, new LintConfig.NamingConfig("this"),
            null, null, null, null);

        // When
        List<Violation> violations = check(rule, RuleSettings.from(config));

        // Then
        assertThat(violations).isEmpty();
    }

    @Test
    void check_withSuppressionRange_dropsViolation() throws IOException {
        // Given: the resource sits inside a Disable/Enable pair
        createFile("main.tf", """
            # ST.001 Disable
            resource "aws_vpc" "main" {
              cidr_block = "10.0.0.0/16"
            }
            # ST.001 Enable

            resource "aws_subnet" "main" {
              vpc_id = aws_vpc.main.id
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then: only the resource after Enable is reported
        assertThat(lines(violations)).containsExactly(7);
    }

    @Test
    void check_withModuleBlock_ignoresIt() throws IOException {
        // Given
        createFile("main.tf", """
            module "network" {
              source = "./network"
            }
            """);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }
}
