package com.terralint.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Line interval in which one rule is inactive for one file.
 *
 * @param ruleId suppressed rule id
 * @param file file the range belongs to
 * @param startLine first suppressed line (the line after the Disable directive)
 * @param endLine last suppressed line, {@link #OPEN_END} when the range runs to end of file
 */
public record SuppressionRange(
    String ruleId,
    Path file,
    int startLine,
    int endLine
) {
    /**
     * End marker of a range without a matching Enable directive.
     */
    public static final int OPEN_END = Integer.MAX_VALUE;

    /**
     * Compact constructor with validation.
     */
    public SuppressionRange {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(file, "file must not be null");
    }

    public boolean covers(int line) {
        return line >= startLine && line <= endLine;
    }

    public boolean isOpenEnded() {
        return endLine == OPEN_END;
    }
}
