package com.terralint.core.rule;

import com.terralint.core.model.Severity;

import java.nio.file.Path;

/**
 * The only side effect available to a rule: report one violation.
 *
 * <p>The engine supplies a sink bound to the running rule. It fills in the rule id and
 * category, drops reports covered by a suppression range and drops repeats of the same file
 * and line.</p>
 */
@FunctionalInterface
public interface ViolationSink {

    /**
     * Reports a violation with an explicit severity.
     *
     * @param file file (or directory) the violation is attributed to
     * @param line 1-based line, or 0 when the violation is not line specific
     * @param message human-readable message
     * @param severity severity, or null for the rule's own severity
     */
    void report(Path file, int line, String message, Severity severity);

    /**
     * Reports a violation with the rule's own severity.
     *
     * @param file file (or directory) the violation is attributed to
     * @param line 1-based line, or 0 when the violation is not line specific
     * @param message human-readable message
     */
    default void report(Path file, int line, String message) {
        report(file, line, message, null);
    }
}
