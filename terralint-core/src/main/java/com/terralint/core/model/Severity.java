package com.terralint.core.model;

import java.util.Locale;

/**
 * Severity level of a rule violation.
 *
 * <p>Errors fail a lint run (non-zero exit code); warnings are reported but do not.</p>
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Error - the configuration violates a mandatory convention.
     */
    ERROR,

    /**
     * Warning - potential issue that should be reviewed.
     */
    WARNING;

    /**
     * Parses a severity name case-insensitively ("error", "WARNING").
     *
     * @param value severity name
     * @return matching severity
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Severity fromString(String value) {
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns the lowercase label used in reports.
     *
     * @return "error" or "warning"
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
