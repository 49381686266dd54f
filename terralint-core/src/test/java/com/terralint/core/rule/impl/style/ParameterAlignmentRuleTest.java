package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.Parameter;
import com.terralint.core.model.SourceFile;
import com.terralint.core.model.Violation;
import com.terralint.core.parser.BlockExtractor;
import com.terralint.core.parser.LineInfo;
import com.terralint.core.parser.ParsedFile;
import com.terralint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link ParameterAlignmentRule}.
 */
class ParameterAlignmentRuleTest extends RuleTestBase {

    private final ParameterAlignmentRule rule = new ParameterAlignmentRule();

    @Test
    void check_withMisalignedSection_reportsShortName() throws IOException {
        // Given: '=' of ami is not aligned with instance_type
        createFile("main.tf", """
            resource "aws_instance" "test" {
              ami = "ami-123"
              instance_type = "t3.micro"
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).line()).isEqualTo(2);
        assertThat(violations.get(0).message()).isEqualTo(
            "Parameter assignment not aligned with other parameters in resource \"aws_instance\" \"test\""
                + " (expected '=' at column 17, found column 7)");
    }

    @Test
    void check_withAlignedSection_reportsNothing() throws IOException {
        // Given: the aligned form of the previous fixture
        createFile("main.tf", """
            resource "aws_instance" "test" {
              ami           = "ami-123"
              instance_type = "t3.micro"
            }
            """);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }

    @Test
    void check_withBlankLineBetweenParameters_alignsSectionsIndependently() throws IOException {
        // Given
        createFile("main.tf", """
            resource "aws_instance" "test" {
              ami = "ami-123"

              instance_type = "t3.micro"
            }
            """);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }

    @Test
    void check_withTwoSpacesAfterEquals_reportsSpacing() throws IOException {
        // Given
        createFile("main.tf", """
            resource "aws_instance" "test" {
              ami =  "ami-123"
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(violations).extracting(Violation::message).containsExactly(
            "Parameter assignment should have exactly one space after '=' in resource \"aws_instance\" \"test\"");
    }

    @Test
    void check_withQuotedMapKeys_countsQuotesInWidth() throws IOException {
        // Given: quoted keys aligned as terraform fmt does
        createFile("main.tf", """
            resource "aws_instance" "test" {
              tags = {
                "Name"  = "web"
                "Owner" = "ops"
              }
            }
            """);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }

    @Test
    void check_withMisalignedMapEntries_reportsEntryLine() throws IOException {
        // Given
        createFile("main.tf", """
            resource "aws_instance" "test" {
              tags = {
                Name = "web"
                Environment = "prod"
              }
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(lines(violations)).containsExactly(3);
    }

    @Test
    void check_withInlineParameterSpacing_reportsInlineMessage() throws IOException {
        // Given
        createFile("variables.tf", """
            variable "name" { type  = string }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(violations).extracting(Violation::message).containsExactly(
            "Parameter 'type' should have exactly one space before and after '=' in variable \"name\"");
    }

    @Test
    void sections_withNestedBlock_splitsAroundIt() {
        // Given
        SourceFile source = SourceFile.of(Path.of("main.tf"), """
            resource "aws_security_group" "test" {
              name = "web"
              ingress {
                from_port = 80
              }
              description = "web"
            }
            """);
        ParsedFile file = new BlockExtractor().extract(source);
        Block resource = file.topLevel(BlockKind.RESOURCE).get(0);

        // When
        List<List<Parameter>> sections = ParameterAlignmentRule.sections(file, resource);

        // Then
        assertThat(sections).hasSize(2);
        assertThat(sections.get(0)).extracting(Parameter::name).containsExactly("name");
        assertThat(sections.get(1)).extracting(Parameter::name).containsExactly("description");
    }

    @Test
    void check_withParameterAfterHeredoc_keepsHeredocInSection() throws IOException {
        // Given: a heredoc value is a scalar and stays in the running section
        createFile("main.tf", """
            resource "aws_instance" "test" {
              user_data = <<EOF
            echo hello
            EOF
              ami       = "ami-1"
            }
            """);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }

    @Test
    void check_withMultiLineConditional_keepsItInSection() throws IOException {
        // Given
        createFile("main.tf", """
            resource "aws_instance" "test" {
              instance_type = var.large ? (
                "c6.large"
              ) : "c6.small"
              ami           = "ami-1"
            }
            """);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }

    @Test
    void check_withParameterAlignedOnlyAfterHeredoc_reportsIt() throws IOException {
        // Given: ami is aligned as if the heredoc had closed the section
        createFile("main.tf", """
            resource "aws_instance" "test" {
              user_data = <<EOF
            echo hello
            EOF
              ami = "ami-1"
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(lines(violations)).containsExactly(5);
    }

    @Test
    void check_withMultiLineMap_startsNewSectionAfterIt() throws IOException {
        // Given
        createFile("main.tf", """
            resource "aws_instance" "test" {
              ami  = "ami-1"
              tags = {
                Name = "web"
              }
              instance_type = "t3.micro"
            }
            """);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }

    @Test
    void check_afterRealigningToExpectedColumns_reportsNothing() throws IOException {
        // Given: several sections with quoted keys, a heredoc and nested maps, all misaligned
        String content = """
            resource "aws_instance" "test" {
              ami = "ami-1"
              user_data = <<EOF
            echo hello
            EOF
              monitoring =  true

              tags = {
                Name = "web"
                "Cost-Center" = "ops"
                nested = {
                  a = 1
                  bbbb = 2
                }
              }
              instance_type =   "t3.micro"

              ebs_block_device {
                device_name = "/dev/sdb"
                volume_size =  20
                encrypted = true
              }
            }
            """;
        createFile("main.tf", content);
        assertThat(check(rule)).isNotEmpty();

        // When
        createFile("main.tf", realign(content));

        // Then
        assertThat(check(rule)).isEmpty();
    }

    /**
     * Rewrites every parameter line so its '=' sits at the column computed from its section.
     */
    private static String realign(String content) {
        ParsedFile file = new BlockExtractor().extract(SourceFile.of(Path.of("main.tf"), content));
        List<List<Parameter>> sections = new ArrayList<>();
        file.root().descendantsAndSelf().forEach(block -> {
            sections.addAll(ParameterAlignmentRule.sections(file, block));
            block.parameters().forEach(parameter -> collectEntrySections(file, parameter, sections));
        });

        String[] lines = content.split("\n", -1);
        for (List<Parameter> section : sections) {
            int width = section.stream().mapToInt(Parameter::nameWidth).max().orElse(0);
            for (Parameter parameter : section) {
                LineInfo line = file.line(parameter.line());
                int equals = line.masked().indexOf('=');
                String text = line.text();
                int indent = text.length() - text.stripLeading().length();
                String name = text.substring(indent, equals).strip();
                String value = text.substring(equals + 1).strip();
                lines[parameter.line() - 1] = " ".repeat(indent) + String.format("%-" + width + "s", name) + " = " + value;
            }
        }
        return String.join("\n", lines);
    }

    private static void collectEntrySections(ParsedFile file, Parameter parameter, List<List<Parameter>> into) {
        into.addAll(ParameterAlignmentRule.entrySections(file, parameter));
        parameter.entries().forEach(entry -> collectEntrySections(file, entry, into));
    }
}
