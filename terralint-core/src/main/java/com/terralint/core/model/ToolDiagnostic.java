package com.terralint.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A problem with the linter itself rather than with the linted configuration:
 * a rule that threw, an unreadable file or a malformed suppression directive.
 *
 * <p>Diagnostics are reported next to violations but never count as errors.</p>
 *
 * @param file file being processed when the problem occurred
 * @param ruleId rule involved, or {@code null} when not rule specific
 * @param message description of the problem
 */
public record ToolDiagnostic(
    Path file,
    String ruleId,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public ToolDiagnostic {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
