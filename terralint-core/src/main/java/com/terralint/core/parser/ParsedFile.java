package com.terralint.core.parser;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.SourceFile;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of block extraction for one file: the block tree, the per-line lexical facts and
 * the first structural problem found, if any.
 *
 * @param source raw file
 * @param root synthetic root block spanning the whole file
 * @param lines lexical facts, index 0 holds line 1
 * @param error first parse error, or null when the tree can be trusted
 */
public record ParsedFile(
    SourceFile source,
    Block root,
    List<LineInfo> lines,
    ParseError error
) {
    /**
     * Compact constructor with validation.
     */
    public ParsedFile {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(root, "root must not be null");
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public Path path() {
        return source.path();
    }

    public Optional<ParseError> parseError() {
        return Optional.ofNullable(error);
    }

    public boolean hasParseError() {
        return error != null;
    }

    /**
     * Returns the lexical facts of a 1-based line.
     *
     * @param number line number starting at 1
     * @return line facts
     */
    public LineInfo line(int number) {
        return lines.get(number - 1);
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Returns the top-level blocks of the given kind in source order.
     *
     * @param kind block kind
     * @return matching top-level blocks
     */
    public List<Block> topLevel(BlockKind kind) {
        return root.children(kind);
    }
}
