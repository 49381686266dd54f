package com.terralint.core.rule.base;

import java.util.regex.Pattern;

/**
 * Shared patterns and small text helpers for Terraform rules.
 *
 * @since 1.0.0
 */
public final class TerraformPatterns {

    /** {@code var.NAME}. Captures: (1) variable name. */
    public static final Pattern VARIABLE_REFERENCE =
        Pattern.compile("\\bvar\\.([A-Za-z_][\\w-]*)");

    /** Lowercase snake case, not starting with an underscore or digit. */
    public static final Pattern SNAKE_CASE =
        Pattern.compile("^[a-z][a-z0-9_]*$");

    // Private constructor to prevent instantiation
    private TerraformPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns true when the character at {@code index} sits inside the argument list of a
     * {@code try(...)} call on the same line.
     *
     * <p>Walks outwards through every enclosing parenthesis, so {@code try(lookup(x[0]), null)}
     * counts as enclosed.</p>
     *
     * @param masked line text with string contents blanked
     * @param index column of the expression
     * @return true if some enclosing call is {@code try}
     */
    public static boolean isInsideTry(String masked, int index) {
        int depth = 0;
        for (int i = Math.min(index, masked.length()) - 1; i >= 0; i--) {
            char c = masked.charAt(i);
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                if (depth > 0) {
                    depth--;
                } else if (precedingIdentifier(masked, i).equals("try")) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String precedingIdentifier(String text, int parenIndex) {
        int end = parenIndex;
        while (end > 0 && text.charAt(end - 1) == ' ') {
            end--;
        }
        int start = end;
        while (start > 0 && (Character.isLetterOrDigit(text.charAt(start - 1)) || text.charAt(start - 1) == '_')) {
            start--;
        }
        return text.substring(start, end);
    }

    /**
     * Returns true for a value written as the literal {@code true}, with or without quotes.
     *
     * @param value raw value text
     * @return true if the value is true
     */
    public static boolean isTrueLiteral(String value) {
        String trimmed = value.trim();
        return "true".equals(trimmed) || "\"true\"".equals(trimmed);
    }
}
