package com.terralint.core.parser;

import java.util.List;

/**
 * Lexical facts about one source line, computed once per file and shared by all rules.
 *
 * @param number 1-based line number
 * @param text raw line text
 * @param kind lexical classification
 * @param code line text with comments blanked out (string literals kept)
 * @param masked {@code code} with the contents of string literals and templates blanked out
 * @param commentColumn 0-based column where a comment starts, or -1
 * @param brackets bracket characters found in code, in column order
 * @param indentLevel nesting level expected for the line's indentation
 * @param continuation whether the line continues an expression started on a previous line
 * @param opensHeredoc whether a heredoc body starts on the next line
 */
public record LineInfo(
    int number,
    String text,
    LineKind kind,
    String code,
    String masked,
    int commentColumn,
    List<BracketEvent> brackets,
    int indentLevel,
    boolean continuation,
    boolean opensHeredoc
) {
    /**
     * Compact constructor with defaults.
     */
    public LineInfo {
        code = code == null ? "" : code;
        masked = masked == null ? "" : masked;
        brackets = brackets == null ? List.of() : List.copyOf(brackets);
    }

    public boolean isBlank() {
        return kind == LineKind.BLANK;
    }

    public boolean isCode() {
        return kind == LineKind.CODE;
    }

    public boolean isHeredoc() {
        return kind.isHeredoc();
    }

    public boolean hasComment() {
        return commentColumn >= 0;
    }

    /**
     * Returns the comment part of the line, including its marker.
     *
     * @return comment text, or empty string
     */
    public String comment() {
        return commentColumn >= 0 ? text.substring(commentColumn) : "";
    }

    /**
     * Returns the leading whitespace of the raw line.
     *
     * @return leading spaces and tabs
     */
    public String leadingWhitespace() {
        int i = 0;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return text.substring(0, i);
    }

    /**
     * Returns the bracket delta of the line (openers minus closers).
     *
     * @return net bracket change
     */
    public int bracketDelta() {
        int delta = 0;
        for (BracketEvent event : brackets) {
            delta += event.isOpening() ? 1 : -1;
        }
        return delta;
    }
}
