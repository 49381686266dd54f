package com.terralint.core.report;

import com.terralint.core.model.ToolDiagnostic;
import com.terralint.core.model.Violation;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Line formats shared by the text report and the console.
 *
 * <pre>
 * ERROR: modules/vpc/main.tf (12): [ST.001] Resource 'aws_vpc' instance name 'main' should be 'test'
 * main.tf:12 [ST.001] Resource 'aws_vpc' instance name 'main' should be 'test'
 * </pre>
 */
public final class ViolationFormat {

    private ViolationFormat() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Formats a violation with its full path: {@code ERROR: <path> (<line>): [<rule>] <message>}.
     * Violations without a line drop the parenthesised part.
     *
     * @param violation violation
     * @return detailed line
     */
    public static String detailed(Violation violation) {
        String level = violation.severity().name().toUpperCase(Locale.ROOT);
        if (violation.hasLine()) {
            return level + ": " + violation.file() + " (" + violation.line() + "): ["
                + violation.ruleId() + "] " + violation.message();
        }
        return level + ": " + violation.file() + ": [" + violation.ruleId() + "] " + violation.message();
    }

    /**
     * Formats a violation with the file's base name: {@code <basename>:<line> [<rule>] <message>}.
     *
     * @param violation violation
     * @return summary line
     */
    public static String summary(Violation violation) {
        String name = baseName(violation.file());
        if (violation.hasLine()) {
            return name + ":" + violation.line() + " [" + violation.ruleId() + "] " + violation.message();
        }
        return name + " [" + violation.ruleId() + "] " + violation.message();
    }

    public static String diagnostic(ToolDiagnostic diagnostic) {
        String rule = diagnostic.ruleId() != null ? " [" + diagnostic.ruleId() + "]" : "";
        return diagnostic.file() + rule + ": " + diagnostic.message();
    }

    private static String baseName(Path path) {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }
}
