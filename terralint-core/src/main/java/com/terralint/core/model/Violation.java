package com.terralint.core.model;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;

/**
 * A single rule violation attributed to a file (or directory) and line.
 *
 * <p>A line of {@code 0} means the violation concerns the whole file or directory,
 * for example a file naming violation.</p>
 *
 * @param file file or directory the violation is attributed to
 * @param ruleId rule id such as {@code ST.001}
 * @param category rule category
 * @param severity severity of the rule
 * @param message human-readable message
 * @param line 1-based line number, or 0 when not line specific
 */
public record Violation(
    Path file,
    String ruleId,
    RuleCategory category,
    Severity severity,
    String message,
    int line
) {
    /**
     * Pseudo rule id used for files whose block structure could not be extracted.
     */
    public static final String PARSE_RULE_ID = "PARSE";

    /**
     * Orders violations of one file by line, then rule id.
     */
    public static final Comparator<Violation> BY_LINE_THEN_RULE =
        Comparator.comparingInt(Violation::line).thenComparing(Violation::ruleId);

    /**
     * Compact constructor with validation.
     */
    public Violation {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (line < 0) {
            throw new IllegalArgumentException("line must not be negative: " + line);
        }
    }

    /**
     * Creates the diagnostic violation for a file that failed block extraction.
     *
     * @param file offending file
     * @param message parse error description
     * @param line line where the error was detected
     * @return parse violation
     */
    public static Violation parseError(Path file, String message, int line) {
        return new Violation(file, PARSE_RULE_ID, RuleCategory.ST, Severity.ERROR, message, line);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public boolean hasLine() {
        return line > 0;
    }
}
