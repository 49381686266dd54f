package com.terralint.core.model;

import java.util.Objects;

/**
 * A block header label such as {@code "aws_vpc"} in {@code resource "aws_vpc" "test"}.
 *
 * @param value label text without quotes
 * @param quoted whether the label was written in double quotes
 */
public record Label(
    String value,
    boolean quoted
) {
    /**
     * Compact constructor with validation.
     */
    public Label {
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Parses a raw header token, stripping surrounding double quotes.
     *
     * @param token raw token, e.g. {@code "test"} or {@code test}
     * @return label
     */
    public static Label parse(String token) {
        if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")) {
            return new Label(token.substring(1, token.length() - 1), true);
        }
        return new Label(token, false);
    }
}
