package com.terralint.core.parser;

/**
 * A bracket character found in code (outside strings, templates and comments).
 *
 * @param symbol one of {@code { } [ ] ( )}
 * @param column 0-based column of the character
 */
public record BracketEvent(char symbol, int column) {

    public boolean isOpening() {
        return symbol == '{' || symbol == '[' || symbol == '(';
    }

    public boolean isBrace() {
        return symbol == '{' || symbol == '}';
    }
}
