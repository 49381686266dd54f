package com.terralint.core.report;

import com.terralint.core.config.ConfigurationException;

import java.util.Locale;

/**
 * Format of the report files written after a lint run.
 */
public enum ReportFormat {
    TEXT,
    JSON,
    BOTH;

    /**
     * Parses a format name case-insensitively.
     *
     * @param value {@code text}, {@code json} or {@code both}
     * @return format
     * @throws ConfigurationException if the name is unknown
     */
    public static ReportFormat fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown report format: '" + value + "' (expected text, json or both)", e);
        }
    }

    public boolean includesText() {
        return this != JSON;
    }

    public boolean includesJson() {
        return this != TEXT;
    }
}
