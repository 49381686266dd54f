package com.terralint.core.parser;

/**
 * Lexical classification of a source line.
 */
public enum LineKind {
    /** Empty or whitespace-only line outside heredocs. */
    BLANK,
    /** Line holding only a comment (or the inside of a block comment). */
    COMMENT,
    /** Line with configuration code, possibly followed by a comment. */
    CODE,
    /** Line inside a heredoc body. */
    HEREDOC_BODY,
    /** Line holding the closing heredoc marker. */
    HEREDOC_END;

    /**
     * Returns true for lines that belong to a heredoc and are excluded from formatting checks.
     *
     * @return true for heredoc body and closing marker lines
     */
    public boolean isHeredoc() {
        return this == HEREDOC_BODY || this == HEREDOC_END;
    }
}
