package com.terralint.cli;

import com.terralint.TerraLintCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for the {@code lint} command.
 */
@DisplayName("lint command")
class LintCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;
    private Path stack;

    @BeforeEach
    void setUp() throws IOException {
        commandLine = TerraLintCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        stack = Files.createDirectories(tempDir.resolve("stack"));
    }

    private int lint(String... args) {
        String[] full = new String[args.length + 1];
        full[0] = "lint";
        System.arraycopy(args, 0, full, 1, args.length);
        return commandLine.execute(full);
    }

    @Test
    @DisplayName("Should exit 0 when no rule reports an error")
    void cleanConfiguration_exitsZero() throws IOException {
        Files.writeString(stack.resolve("main.tf"), """
            resource "aws_vpc" "test" {
              cidr_block = "10.0.0.0/16"
            }
            """);

        int exitCode = lint(stack.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("✓ 1 file(s) checked, 0 error(s), 0 warning(s)");
    }

    @Test
    @DisplayName("Should exit 1 and print the violation when a rule reports an error")
    void violation_exitsOne() throws IOException {
        Files.writeString(stack.resolve("main.tf"), """
            resource "aws_vpc" "main" {
              cidr_block = "10.0.0.0/16"
            }
            """);

        int exitCode = lint(stack.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("(1): [ST.001] Resource 'aws_vpc' instance name 'main' should be 'test'")
            .contains("✗ 1 file(s) checked, 1 error(s)");
    }

    @Test
    @DisplayName("Should honour --ignore-rules")
    void ignoredRule_exitsZero() throws IOException {
        Files.writeString(stack.resolve("main.tf"), """
            resource "aws_vpc" "main" {
              cidr_block = "10.0.0.0/16"
            }
            """);

        int exitCode = lint(stack.toString(), "--ignore-rules", "ST.001");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).doesNotContain("[ST.001]");
    }

    @Test
    @DisplayName("Should exit 2 for an unknown rule id")
    void unknownRule_exitsTwo() throws IOException {
        Files.writeString(stack.resolve("main.tf"), "locals {}\n");

        int exitCode = lint(stack.toString(), "--ignore-rules", "XX.999");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("✗ Invalid configuration: Unknown rule id: 'XX.999'");
    }

    @Test
    @DisplayName("Should exit 2 when no Terraform files are found")
    void emptyDirectory_exitsTwo() {
        int exitCode = lint(stack.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("✗ No Terraform files found in: ");
    }

    @Test
    @DisplayName("Should exit 2 when the target does not exist")
    void missingTarget_exitsTwo() {
        int exitCode = lint(tempDir.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("✗ Path does not exist: ");
    }

    @Test
    @DisplayName("Should write text and json reports into --report-dir")
    void reportDirectory_writesBothReports() throws IOException {
        Files.writeString(stack.resolve("main.tf"), """
            resource "aws_vpc" "main" {
              cidr_block = "10.0.0.0/16"
            }
            """);
        Path reports = tempDir.resolve("reports");

        lint(stack.toString(), "--report-format", "both", "--report-dir", reports.toString());

        assertThat(reports.resolve("terralint-report.txt")).exists();
        assertThat(reports.resolve("terralint-report.json")).exists();
        assertThat(Files.readString(reports.resolve("terralint-report.txt"))).contains("Total Errors: 1");
        assertThat(out.toString()).contains("✓ Report written to: ");
    }

    @Test
    @DisplayName("Should read rule selection from an explicit --config file")
    void explicitConfig_selectsCategories() throws IOException {
        Files.writeString(stack.resolve("main.tf"), """
            resource "aws_vpc" "main" {
              cidr_block = "10.0.0.0/16"
            }
            """);
        Path config = Files.writeString(tempDir.resolve("custom.yaml"), """
            rules:
              categories: [DC]
            """);

        int exitCode = lint(stack.toString(), "--config", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).doesNotContain("[ST.001]");
    }

    @Test
    @DisplayName("Should exit 2 when an explicit --config file is missing")
    void missingExplicitConfig_exitsTwo() throws IOException {
        Files.writeString(stack.resolve("main.tf"), "locals {}\n");

        int exitCode = lint(stack.toString(), "--config", tempDir.resolve("absent.yaml").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Configuration file not found or not readable");
    }

    @Test
    @DisplayName("Should pick up terralint.yaml in the target directory")
    void implicitConfig_isApplied() throws IOException {
        Files.writeString(stack.resolve("main.tf"), """
            resource "aws_vpc" "main" {
              cidr_block = "10.0.0.0/16"
            }
            """);
        Files.writeString(stack.resolve("terralint.yaml"), """
            naming:
              instanceName: main
            """);

        int exitCode = lint(stack.toString());

        assertThat(exitCode).isZero();
    }
}
