package com.terralint.core.parser;

import com.terralint.core.model.SourceFile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Line-oriented lexer for Terraform configuration text.
 *
 * <p>Walks the file once, tracking whether each character is code, part of a quoted string,
 * part of a {@code ${...}} or {@code %{...}} template inside a string, part of a comment or part
 * of a heredoc body. The result is one {@link LineInfo} per line. Bracket characters are
 * recorded only when they are code, so braces inside strings, comments and heredocs never
 * affect block structure.</p>
 *
 * <p><b>Heredocs:</b> a {@code <<MARKER} or {@code <<-MARKER} token in code starts a heredoc
 * on the next line. The body ends on a line that is exactly {@code MARKER}; for the
 * {@code <<-} form the marker may be indented.</p>
 *
 * <p><b>Indentation levels:</b> every line that leaves brackets open pushes one level, no
 * matter how many brackets it opens ({@code object(&#123;} is one level). Closing brackets at
 * the start of a line pop levels before the line's own level is taken.</p>
 *
 * <p>Instances are stateless; {@link #lex(SourceFile)} is safe to call concurrently.</p>
 */
public class TerraformLexer {

    private static final String CONTINUATION_ENDINGS = "?:+-*/%=<>&|";

    private enum Mode { STRING, TEMPLATE }

    private static final class ModeFrame {
        private final Mode mode;
        private int braceDepth;

        private ModeFrame(Mode mode) {
            this.mode = mode;
        }
    }

    /**
     * Output of a lexing pass.
     *
     * @param lines one entry per source line
     * @param error first lexical error, or null
     */
    public record Result(List<LineInfo> lines, ParseError error) {

        public Optional<ParseError> parseError() {
            return Optional.ofNullable(error);
        }
    }

    /**
     * Lexes a whole file.
     *
     * @param source file to lex
     * @return per-line facts and an optional lexical error
     */
    public Result lex(SourceFile source) {
        List<LineInfo> result = new ArrayList<>(source.lineCount());
        Deque<ModeFrame> modes = new ArrayDeque<>();
        Deque<int[]> levels = new ArrayDeque<>();

        boolean inBlockComment = false;
        int blockCommentStart = 0;
        String heredocMarker = null;
        boolean heredocIndented = false;
        int heredocStart = 0;
        int stringStart = 0;

        for (int number = 1; number <= source.lineCount(); number++) {
            String text = source.line(number);

            if (heredocMarker != null) {
                boolean closes = heredocIndented
                    ? text.trim().equals(heredocMarker)
                    : text.equals(heredocMarker);
                LineKind kind = closes ? LineKind.HEREDOC_END : LineKind.HEREDOC_BODY;
                result.add(new LineInfo(number, text, kind, "", "", -1, List.of(), levels.size(), false, false));
                if (closes) {
                    heredocMarker = null;
                }
                continue;
            }

            boolean startsInString = !modes.isEmpty();
            boolean startsInComment = inBlockComment;
            StringBuilder code = new StringBuilder(text.length());
            StringBuilder masked = new StringBuilder(text.length());
            List<BracketEvent> brackets = new ArrayList<>();
            int commentColumn = -1;
            boolean codeSeen = false;
            String openedMarker = null;
            boolean openedIndented = false;

            int i = 0;
            while (i < text.length()) {
                char c = text.charAt(i);
                char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';

                if (inBlockComment) {
                    if (c == '*' && next == '/') {
                        inBlockComment = false;
                        code.append("  ");
                        masked.append("  ");
                        i += 2;
                    } else {
                        code.append(' ');
                        masked.append(' ');
                        i++;
                    }
                    continue;
                }

                ModeFrame top = modes.peek();
                if (top != null && top.mode == Mode.STRING) {
                    codeSeen = true;
                    if (c == '\\' && i + 1 < text.length()) {
                        code.append(c).append(next);
                        masked.append("  ");
                        i += 2;
                    } else if (c == '"') {
                        modes.pop();
                        code.append(c);
                        masked.append(c);
                        i++;
                    } else if ((c == '$' || c == '%') && next == '{') {
                        if (i > 0 && text.charAt(i - 1) == c) {
                            // $${ and %%{ are escapes for a literal sequence
                            code.append(c).append(next);
                            masked.append("  ");
                        } else {
                            modes.push(new ModeFrame(Mode.TEMPLATE));
                            code.append(c).append(next);
                            masked.append("  ");
                        }
                        i += 2;
                    } else {
                        code.append(c);
                        masked.append(' ');
                        i++;
                    }
                    continue;
                }

                if (top != null) {
                    // template expression inside a string
                    codeSeen = true;
                    if (c == '"') {
                        modes.push(new ModeFrame(Mode.STRING));
                    } else if (c == '{') {
                        top.braceDepth++;
                    } else if (c == '}') {
                        if (top.braceDepth == 0) {
                            modes.pop();
                        } else {
                            top.braceDepth--;
                        }
                    }
                    code.append(c);
                    masked.append(' ');
                    i++;
                    continue;
                }

                if (c == '#' || (c == '/' && next == '/')) {
                    commentColumn = i;
                    break;
                }
                if (c == '/' && next == '*') {
                    if (commentColumn < 0 && !codeSeen) {
                        commentColumn = i;
                    }
                    inBlockComment = true;
                    blockCommentStart = number;
                    code.append("  ");
                    masked.append("  ");
                    i += 2;
                    continue;
                }
                if (c == '"') {
                    modes.push(new ModeFrame(Mode.STRING));
                    stringStart = number;
                    codeSeen = true;
                    code.append(c);
                    masked.append(c);
                    i++;
                    continue;
                }
                if (c == '<' && next == '<' && openedMarker == null) {
                    int j = i + 2;
                    boolean indented = j < text.length() && text.charAt(j) == '-';
                    if (indented) {
                        j++;
                    }
                    int markerStart = j;
                    while (j < text.length() && isMarkerChar(text.charAt(j), j == markerStart)) {
                        j++;
                    }
                    if (j > markerStart) {
                        openedMarker = text.substring(markerStart, j);
                        openedIndented = indented;
                        code.append(text, i, j);
                        masked.append(text, i, j);
                        codeSeen = true;
                        i = j;
                        continue;
                    }
                }
                if ("{}[]()".indexOf(c) >= 0) {
                    brackets.add(new BracketEvent(c, i));
                }
                if (!Character.isWhitespace(c)) {
                    codeSeen = true;
                }
                code.append(c);
                masked.append(c);
                i++;
            }

            LineKind kind;
            if (codeSeen) {
                kind = LineKind.CODE;
            } else if (commentColumn >= 0 || startsInComment || inBlockComment) {
                kind = LineKind.COMMENT;
                if (commentColumn < 0) {
                    commentColumn = firstNonWhitespace(text);
                }
            } else {
                kind = LineKind.BLANK;
            }

            int indentLevel = applyBrackets(levels, brackets, masked.toString());

            if (openedMarker != null) {
                heredocMarker = openedMarker;
                heredocIndented = openedIndented;
                heredocStart = number;
            }

            result.add(new LineInfo(
                number,
                text,
                kind,
                kind == LineKind.CODE ? code.toString() : "",
                kind == LineKind.CODE ? masked.toString() : "",
                commentColumn,
                brackets,
                indentLevel,
                startsInString,
                openedMarker != null
            ));
        }

        ParseError error = null;
        if (heredocMarker != null) {
            error = new ParseError("Unterminated heredoc '" + heredocMarker + "' starting at line " + heredocStart, heredocStart);
        } else if (!modes.isEmpty()) {
            error = new ParseError("Unterminated string starting at line " + stringStart, stringStart);
        } else if (inBlockComment) {
            error = new ParseError("Unterminated block comment starting at line " + blockCommentStart, blockCommentStart);
        }

        return new Result(markContinuations(result), error);
    }

    /**
     * Updates the level stack with one line's brackets and returns the level of that line.
     */
    private int applyBrackets(Deque<int[]> levels, List<BracketEvent> brackets, String masked) {
        int leadingClosers = countLeadingClosers(masked);
        int index = 0;
        for (; index < leadingClosers && index < brackets.size(); index++) {
            close(levels);
        }
        int lineLevel = levels.size();

        int[] opened = null;
        for (; index < brackets.size(); index++) {
            BracketEvent event = brackets.get(index);
            if (event.isOpening()) {
                if (opened == null) {
                    opened = new int[] {0};
                    levels.push(opened);
                }
                opened[0]++;
            } else if (opened != null && opened[0] > 0) {
                opened[0]--;
                if (opened[0] == 0) {
                    levels.pop();
                    opened = null;
                }
            } else {
                close(levels);
            }
        }
        return lineLevel;
    }

    private void close(Deque<int[]> levels) {
        int[] top = levels.peek();
        if (top == null) {
            return;
        }
        top[0]--;
        if (top[0] <= 0) {
            levels.pop();
        }
    }

    private int countLeadingClosers(String masked) {
        int count = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '}' || c == ']' || c == ')') {
                count++;
            } else if (!Character.isWhitespace(c)) {
                break;
            }
        }
        return count;
    }

    private List<LineInfo> markContinuations(List<LineInfo> lines) {
        List<LineInfo> marked = new ArrayList<>(lines.size());
        LineInfo previousCode = null;
        for (LineInfo line : lines) {
            if (line.kind() == LineKind.CODE) {
                boolean continuation = line.continuation()
                    || endsWithOperator(previousCode)
                    || startsWithOperator(line.masked());
                if (continuation != line.continuation()) {
                    line = new LineInfo(line.number(), line.text(), line.kind(), line.code(), line.masked(),
                        line.commentColumn(), line.brackets(), line.indentLevel(), true, line.opensHeredoc());
                }
                previousCode = line;
            } else if (line.isHeredoc()) {
                previousCode = null;
            }
            marked.add(line);
        }
        return marked;
    }

    private boolean endsWithOperator(LineInfo line) {
        if (line == null || line.opensHeredoc()) {
            return false;
        }
        String trimmed = line.masked().stripTrailing();
        return !trimmed.isEmpty() && CONTINUATION_ENDINGS.indexOf(trimmed.charAt(trimmed.length() - 1)) >= 0;
    }

    private boolean startsWithOperator(String masked) {
        String trimmed = masked.stripLeading();
        return trimmed.startsWith("?") || trimmed.startsWith(":")
            || trimmed.startsWith("&&") || trimmed.startsWith("||");
    }

    private static boolean isMarkerChar(char c, boolean first) {
        if (first) {
            return Character.isLetter(c) || c == '_';
        }
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    private static int firstNonWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
