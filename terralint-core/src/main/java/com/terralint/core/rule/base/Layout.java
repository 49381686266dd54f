package com.terralint.core.rule.base;

import com.terralint.core.parser.LineInfo;
import com.terralint.core.parser.ParsedFile;

/**
 * Indentation facts shared by the indentation, tab and alignment rules.
 *
 * <p>The alignment rule skips lines with an indentation problem. It asks this class rather
 * than the indentation rules, so the result does not depend on which rules are enabled.</p>
 */
public final class Layout {

    /** Spaces per nesting level. */
    public static final int INDENT_WIDTH = 2;

    private Layout() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    public static boolean hasTabInIndentation(LineInfo line) {
        return line.leadingWhitespace().indexOf('\t') >= 0;
    }

    /**
     * Counts leading spaces, stopping at the first other character.
     *
     * @param line line facts
     * @return number of leading spaces
     */
    public static int leadingSpaces(LineInfo line) {
        String text = line.text();
        int count = 0;
        while (count < text.length() && text.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    public static int expectedIndent(LineInfo line) {
        return INDENT_WIDTH * line.indentLevel();
    }

    /**
     * Returns true for lines whose indentation level is checked: code lines that do not
     * continue an expression from a previous line.
     *
     * @param line line facts
     * @return true if the indentation level applies
     */
    public static boolean isLevelChecked(LineInfo line) {
        return line.isCode() && !line.continuation();
    }

    /**
     * Returns true when the line has a tab in its indentation or a wrong indentation level.
     *
     * @param line line facts
     * @return true if the line has an indentation problem
     */
    public static boolean hasIndentationProblem(LineInfo line) {
        if (hasTabInIndentation(line)) {
            return true;
        }
        return isLevelChecked(line) && leadingSpaces(line) != expectedIndent(line);
    }

    /**
     * Counts blank lines strictly between two lines. Comment lines are not blank.
     *
     * @param file parsed file
     * @param afterLine line before the gap
     * @param beforeLine line after the gap
     * @return number of blank lines in the gap
     */
    public static int blankLinesBetween(ParsedFile file, int afterLine, int beforeLine) {
        int count = 0;
        for (int number = afterLine + 1; number < beforeLine && number <= file.lineCount(); number++) {
            if (file.line(number).isBlank()) {
                count++;
            }
        }
        return count;
    }
}
