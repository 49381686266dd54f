package com.terralint.core.report;

import com.terralint.core.engine.LintReport;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.model.ToolDiagnostic;
import com.terralint.core.model.Violation;
import com.terralint.core.rule.RuleDescriptor;
import com.terralint.core.rule.impl.io.UnusedVariableRule;
import com.terralint.core.rule.impl.style.DirectoryNamingRule;
import com.terralint.core.rule.impl.style.InstanceNameRule;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Shared report samples for renderer tests.
 */
final class ReportFixtures {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:30:00Z"), ZoneOffset.UTC);

    static final Path MAIN = Path.of("stack", "main.tf");
    static final Path VARIABLES = Path.of("stack", "variables.tf");
    static final Path DIRECTORY = Path.of("stack_one");

    private ReportFixtures() {
    }

    static LintReport sample() {
        return new LintReport(
            List.of(
                new Violation(MAIN, "ST.001", RuleCategory.ST, Severity.ERROR,
                    "Resource 'aws_vpc' instance name 'main' should be 'test'", 3),
                new Violation(DIRECTORY, "ST.013", RuleCategory.ST, Severity.WARNING,
                    "Directory name 'stack_one' does not follow naming convention.", 0),
                new Violation(VARIABLES, "IO.009", RuleCategory.IO, Severity.WARNING,
                    "Variable 'legacy' is defined but never used", 5)
            ),
            List.of(new ToolDiagnostic(MAIN, null, "Malformed suppression directive at line 1: # ST.001 disable")),
            2,
            List.of(
                RuleDescriptor.of(new InstanceNameRule()),
                RuleDescriptor.of(new DirectoryNamingRule()),
                RuleDescriptor.of(new UnusedVariableRule())
            )
        );
    }

    static LintReport clean() {
        return new LintReport(List.of(), List.of(), 4, List.of(RuleDescriptor.of(new InstanceNameRule())));
    }
}
