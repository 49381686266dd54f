package com.terralint.core.parser;

import java.util.Objects;

/**
 * Structural problem that prevents a file's block tree from being trusted.
 *
 * @param message description of the problem
 * @param line line where the problem was detected
 */
public record ParseError(String message, int line) {

    /**
     * Compact constructor with validation.
     */
    public ParseError {
        Objects.requireNonNull(message, "message must not be null");
    }
}
