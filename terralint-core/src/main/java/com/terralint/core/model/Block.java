package com.terralint.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A brace-delimited construct and everything it owns.
 *
 * <p>Every block owns its child blocks and its parameters exclusively. The file root is a
 * synthetic block of kind {@link BlockKind#ROOT} at depth 0 spanning the whole file.</p>
 *
 * @param kind block kind
 * @param keyword header keyword ({@code resource}, {@code ingress}, ...), empty for the root
 * @param labels header labels in order
 * @param startLine header line
 * @param endLine line holding the closing brace
 * @param depth nesting depth, 0 for the root
 * @param children nested blocks in source order
 * @param parameters parameters in source order
 */
public record Block(
    BlockKind kind,
    String keyword,
    List<Label> labels,
    int startLine,
    int endLine,
    int depth,
    List<Block> children,
    List<Parameter> parameters
) {
    /**
     * Compact constructor with validation.
     */
    public Block {
        Objects.requireNonNull(kind, "kind must not be null");
        keyword = keyword == null ? "" : keyword;
        labels = labels == null ? List.of() : List.copyOf(labels);
        children = children == null ? List.of() : List.copyOf(children);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (endLine < startLine) {
            throw new IllegalArgumentException("endLine " + endLine + " before startLine " + startLine);
        }
    }

    /**
     * Returns the type label of resource and data blocks.
     *
     * @return type label, or empty for other kinds
     */
    public Optional<String> typeLabel() {
        if (kind.hasTypeLabel() && !labels.isEmpty()) {
            return Optional.of(labels.get(0).value());
        }
        return Optional.empty();
    }

    /**
     * Returns the instance name: the second label of resource/data blocks, otherwise the first.
     *
     * @return name label, or empty for unlabelled blocks
     */
    public Optional<String> nameLabel() {
        int index = kind.hasTypeLabel() ? 1 : 0;
        return labels.size() > index ? Optional.of(labels.get(index).value()) : Optional.empty();
    }

    /**
     * Name used to group sibling blocks: the label of dynamic blocks, the keyword otherwise.
     *
     * @return structural name
     */
    public String structureName() {
        if (kind == BlockKind.DYNAMIC) {
            return nameLabel().orElse(keyword);
        }
        return keyword;
    }

    /**
     * Looks up a direct parameter by name.
     *
     * @param name parameter name
     * @return first parameter with that name
     */
    public Optional<Parameter> parameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public boolean hasParameter(String name) {
        return parameter(name).isPresent();
    }

    /**
     * Returns direct children of the given kind.
     *
     * @param childKind kind to select
     * @return matching children in source order
     */
    public List<Block> children(BlockKind childKind) {
        return children.stream().filter(b -> b.kind() == childKind).toList();
    }

    /**
     * Streams this block and all descendants, depth first in source order.
     *
     * @return stream of blocks
     */
    public Stream<Block> descendantsAndSelf() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(Block::descendantsAndSelf));
    }

    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }

    /**
     * Human-readable header, e.g. {@code resource "aws_vpc" "test"}.
     *
     * @return description of the block
     */
    public String describe() {
        if (kind == BlockKind.ROOT) {
            return "file";
        }
        List<String> parts = new ArrayList<>();
        parts.add(keyword);
        for (Label label : labels) {
            parts.add('"' + label.value() + '"');
        }
        return String.join(" ", parts);
    }
}
