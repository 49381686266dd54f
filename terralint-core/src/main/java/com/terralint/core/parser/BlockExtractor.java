package com.terralint.core.parser;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.Label;
import com.terralint.core.model.Parameter;
import com.terralint.core.model.ParameterShape;
import com.terralint.core.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw configuration text into a line-accurate tree of {@link Block}s and
 * {@link Parameter}s without a full grammar.
 *
 * <p>Lexing is delegated to {@link TerraformLexer}; this class only sees brace and bracket
 * characters that are real code. Every opening brace opens a frame:</p>
 * <ul>
 *   <li>a block frame when the text before it is a block header
 *       ({@code keyword ["type"] ["name"]}) and the current frame is a block with no
 *       parameter value in progress</li>
 *   <li>a collection frame when it starts the value of a {@code name = } assignment</li>
 *   <li>an anonymous object frame otherwise (for example an object inside a list)</li>
 * </ul>
 * <p>Every closing brace closes the innermost frame. A parameter stays open until the bracket
 * depth returns to where it started and any heredoc it opened has ended.</p>
 *
 * <p>Structural problems are reported as a {@link ParseError} on the result; the tree is
 * still returned, closed at end of file.</p>
 */
public class BlockExtractor {

    private static final Logger log = LoggerFactory.getLogger(BlockExtractor.class);

    private static final Pattern HEADER = Pattern.compile(
        "^\\s*([A-Za-z_][\\w-]*)((?:\\s+(?:\"(?:[^\"\\\\]|\\\\.)*\"|[A-Za-z_][\\w-]*))*)\\s*$");

    private static final Pattern HEADER_LABEL = Pattern.compile(
        "\"(?:[^\"\\\\]|\\\\.)*\"|[A-Za-z_][\\w-]*");

    private static final Pattern ASSIGNMENT = Pattern.compile(
        "^\\s*(?:\"([^\"]*)\"|([A-Za-z_][\\w-]*))\\s*=(?![=>])\\s*(.*)$");

    private static final String OPERATOR_ENDINGS = "?:+-*/%=<>&|";

    private final TerraformLexer lexer;

    public BlockExtractor() {
        this(new TerraformLexer());
    }

    public BlockExtractor(TerraformLexer lexer) {
        this.lexer = lexer;
    }

    /**
     * Extracts the block tree of one file.
     *
     * @param source file to extract
     * @return parsed file; never null, even when the text is malformed
     */
    public ParsedFile extract(SourceFile source) {
        TerraformLexer.Result lexed = lexer.lex(source);
        Walk walk = new Walk(Math.max(1, source.lineCount()));
        for (LineInfo line : lexed.lines()) {
            walk.accept(line);
        }
        Block root = walk.finish();

        ParseError error = lexed.parseError().orElse(walk.error);
        if (error != null) {
            log.debug("Parse error in {} at line {}: {}", source.path(), error.line(), error.message());
        }
        return new ParsedFile(source, root, lexed.lines(), error);
    }

    /**
     * Mutable state of one extraction pass.
     */
    private static final class Walk {

        private final int lastLine;
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final BlockBuilder root;
        private int depth;
        private ParseError error;

        private Walk(int lastLine) {
            this.lastLine = lastLine;
            this.root = new BlockBuilder(BlockKind.ROOT, "", List.of(), 1, 0);
            frames.push(Frame.block(root));
        }

        private void accept(LineInfo line) {
            if (line.kind() == LineKind.HEREDOC_END) {
                ParamBuilder open = frames.peek().openParam;
                if (open != null && open.awaitingHeredoc) {
                    open.awaitingHeredoc = false;
                    closeIfBalanced(frames.peek(), line.number());
                }
                return;
            }
            if (!line.isCode()) {
                return;
            }

            int number = line.number();
            String code = line.code();
            List<BracketEvent> events = line.brackets();

            int index = 0;
            int segmentStart = 0;
            while (index < events.size() && isLeadingCloser(line, events.get(index))) {
                handleCloser(events.get(index), number);
                segmentStart = events.get(index).column() + 1;
                index++;
            }

            Frame top = frames.peek();
            ParamBuilder createdHere = null;
            if (top.openParam == null) {
                if (line.continuation() && top.lastClosed != null) {
                    top.lastClosed.endLine = number;
                    top.openParam = top.lastClosed;
                    top.openParam.baseDepth = depth;
                } else {
                    createdHere = assignment(code.substring(segmentStart), number, top, false);
                }
            }

            for (; index < events.size(); index++) {
                BracketEvent event = events.get(index);
                String head = code.substring(segmentStart, event.column());
                if (event.symbol() == '{') {
                    openBrace(line, event, head, createdHere);
                } else if (event.symbol() == '}') {
                    handleCloser(event, number);
                } else if (event.isOpening()) {
                    depth++;
                } else {
                    depth = Math.max(0, depth - 1);
                }
                segmentStart = event.column() + 1;
            }

            Frame current = frames.peek();
            if (current.openParam != null && !current.openParam.awaitingHeredoc) {
                if (line.opensHeredoc()) {
                    current.openParam.awaitingHeredoc = true;
                } else if (!endsWithOperator(line)) {
                    closeIfBalanced(current, number);
                }
            }
        }

        private void openBrace(LineInfo line, BracketEvent event, String head, ParamBuilder createdHere) {
            int number = line.number();
            Frame top = frames.peek();
            depth++;

            Matcher header = HEADER.matcher(head);
            if (top.isBlock() && top.openParam == null && header.matches()) {
                String keyword = header.group(1);
                List<Label> labels = new ArrayList<>();
                Matcher label = HEADER_LABEL.matcher(header.group(2));
                while (label.find()) {
                    labels.add(Label.parse(label.group()));
                }
                int blockDepth = top.block.depth + 1;
                BlockBuilder block = new BlockBuilder(BlockKind.of(keyword, blockDepth), keyword, labels, number, blockDepth);
                top.block.children.add(block);
                top.lastClosed = null;
                Frame frame = Frame.block(block);
                frames.push(frame);

                int close = closingBraceColumn(line, event);
                if (close > event.column() + 1) {
                    String body = line.code().substring(event.column() + 1, close);
                    ParamBuilder inline = assignment(body, number, frame, true);
                    if (inline != null) {
                        inline.endLine = number;
                    }
                }
                return;
            }

            if (createdHere != null && top.openParam == createdHere && createdHere.collectionFrame == null
                && createdHere.value.startsWith("{")) {
                createdHere.shape = ParameterShape.COLLECTION_LITERAL;
                Frame frame = Frame.object(createdHere);
                createdHere.collectionFrame = frame;
                frames.push(frame);
                return;
            }

            ParamBuilder anonymous = new ParamBuilder("", "{", number, false, false, ParameterShape.COLLECTION_LITERAL, false);
            if (top.openParam != null) {
                top.openParam.entries.add(anonymous);
            } else {
                top.add(anonymous);
            }
            frames.push(Frame.object(anonymous));
        }

        private void handleCloser(BracketEvent event, int number) {
            if (event.symbol() != '}') {
                depth = Math.max(0, depth - 1);
                return;
            }
            if (frames.size() == 1) {
                if (error == null) {
                    error = new ParseError("Unexpected closing brace", number);
                }
                return;
            }
            depth = Math.max(0, depth - 1);
            Frame frame = frames.pop();
            frame.closeAt(number);
            Frame parent = frames.peek();
            if (frame.isBlock()) {
                parent.lastClosed = null;
            }
        }

        private void closeIfBalanced(Frame frame, int number) {
            ParamBuilder open = frame.openParam;
            if (open != null && !open.awaitingHeredoc && depth <= open.baseDepth) {
                open.endLine = Math.max(open.endLine, number);
                frame.lastClosed = open;
                frame.openParam = null;
            }
        }

        private ParamBuilder assignment(String text, int number, Frame frame, boolean inline) {
            Matcher matcher = ASSIGNMENT.matcher(text);
            if (!matcher.matches()) {
                return null;
            }
            boolean quoted = matcher.group(1) != null;
            String name = quoted ? matcher.group(1) : matcher.group(2);
            String value = matcher.group(3).strip();
            boolean meta = frame.isBlock() && Parameter.META_ARGUMENTS.contains(name);
            ParameterShape shape = value.startsWith("{") || value.startsWith("[")
                ? ParameterShape.COLLECTION_LITERAL
                : ParameterShape.SCALAR;
            ParamBuilder param = new ParamBuilder(name, value, number, quoted, meta, shape, inline);
            param.baseDepth = depth;
            frame.add(param);
            frame.openParam = param;
            frame.lastClosed = null;
            return param;
        }

        private Block finish() {
            if (frames.size() > 1 && error == null) {
                Frame outermost = null;
                for (Frame frame : frames) {
                    if (frame.block != root) {
                        outermost = frame;
                    }
                }
                error = outermost.isBlock()
                    ? new ParseError("Unterminated block '" + outermost.block.describe() + "' starting at line "
                        + outermost.block.startLine, outermost.block.startLine)
                    : new ParseError("Unterminated object starting at line " + outermost.owner.line, outermost.owner.line);
            }
            while (frames.size() > 1) {
                frames.pop().closeAt(lastLine);
            }
            root.endLine = lastLine;
            return root.build(lastLine);
        }

        private static boolean isLeadingCloser(LineInfo line, BracketEvent event) {
            if (event.isOpening()) {
                return false;
            }
            String before = line.masked().substring(0, event.column());
            for (int i = 0; i < before.length(); i++) {
                char c = before.charAt(i);
                if (!Character.isWhitespace(c) && c != '}' && c != ']' && c != ')') {
                    return false;
                }
            }
            return true;
        }

        private static int closingBraceColumn(LineInfo line, BracketEvent open) {
            int nesting = 0;
            for (BracketEvent event : line.brackets()) {
                if (event.column() <= open.column() || !event.isBrace()) {
                    continue;
                }
                if (event.isOpening()) {
                    nesting++;
                } else if (nesting == 0) {
                    return event.column();
                } else {
                    nesting--;
                }
            }
            return -1;
        }

        private static boolean endsWithOperator(LineInfo line) {
            String trimmed = line.masked().stripTrailing();
            return !trimmed.isEmpty() && OPERATOR_ENDINGS.indexOf(trimmed.charAt(trimmed.length() - 1)) >= 0;
        }
    }

    /**
     * A brace-delimited scope: a block, or the object value owned by a parameter.
     */
    private static final class Frame {

        private final BlockBuilder block;
        private final ParamBuilder owner;
        private ParamBuilder openParam;
        private ParamBuilder lastClosed;

        private Frame(BlockBuilder block, ParamBuilder owner) {
            this.block = block;
            this.owner = owner;
        }

        static Frame block(BlockBuilder block) {
            return new Frame(block, null);
        }

        static Frame object(ParamBuilder owner) {
            return new Frame(null, owner);
        }

        boolean isBlock() {
            return block != null;
        }

        void add(ParamBuilder param) {
            if (block != null) {
                block.parameters.add(param);
            } else {
                owner.entries.add(param);
            }
        }

        void closeAt(int line) {
            if (openParam != null && openParam.endLine < 0) {
                openParam.endLine = line;
            }
            if (block != null) {
                block.endLine = line;
            } else {
                owner.endLine = Math.max(owner.endLine, line);
            }
        }
    }

    private static final class BlockBuilder {

        private final BlockKind kind;
        private final String keyword;
        private final List<Label> labels;
        private final int startLine;
        private final int depth;
        private final List<BlockBuilder> children = new ArrayList<>();
        private final List<ParamBuilder> parameters = new ArrayList<>();
        private int endLine = -1;

        private BlockBuilder(BlockKind kind, String keyword, List<Label> labels, int startLine, int depth) {
            this.kind = kind;
            this.keyword = keyword;
            this.labels = labels;
            this.startLine = startLine;
            this.depth = depth;
        }

        String describe() {
            StringBuilder text = new StringBuilder(keyword);
            for (Label label : labels) {
                text.append(" \"").append(label.value()).append('"');
            }
            return text.toString();
        }

        Block build(int fallbackEnd) {
            int end = Math.max(startLine, endLine < 0 ? fallbackEnd : endLine);
            List<Block> builtChildren = new ArrayList<>(children.size());
            for (BlockBuilder child : children) {
                builtChildren.add(child.build(end));
            }
            List<Parameter> builtParameters = new ArrayList<>(parameters.size());
            for (ParamBuilder parameter : parameters) {
                builtParameters.add(parameter.build(end));
            }
            return new Block(kind, keyword, labels, startLine, end, depth, builtChildren, builtParameters);
        }
    }

    private static final class ParamBuilder {

        private final String name;
        private final String value;
        private final int line;
        private final boolean quotedName;
        private final boolean meta;
        private final boolean inline;
        private final List<ParamBuilder> entries = new ArrayList<>();
        private ParameterShape shape;
        private int endLine = -1;
        private int baseDepth;
        private boolean awaitingHeredoc;
        private Frame collectionFrame;

        private ParamBuilder(String name, String value, int line, boolean quotedName, boolean meta,
                             ParameterShape shape, boolean inline) {
            this.name = name;
            this.value = value;
            this.line = line;
            this.quotedName = quotedName;
            this.meta = meta;
            this.shape = shape;
            this.inline = inline;
        }

        Parameter build(int fallbackEnd) {
            int end = Math.max(line, endLine < 0 ? fallbackEnd : endLine);
            List<Parameter> builtEntries = new ArrayList<>(entries.size());
            for (ParamBuilder entry : entries) {
                builtEntries.add(entry.build(end));
            }
            return new Parameter(name, value, line, end, quotedName, meta, shape, inline, builtEntries);
        }
    }
}
