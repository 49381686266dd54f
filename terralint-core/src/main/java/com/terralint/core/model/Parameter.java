package com.terralint.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A {@code name = value} entry of a block or of a collection literal.
 *
 * <p>Multi-line values (heredocs, multi-line maps, lists and calls) span
 * {@code line..endLine}. Keys of a nested collection literal are kept in {@code entries};
 * anonymous objects inside a list are entries with an empty name.</p>
 *
 * @param name parameter name without quotes, empty for anonymous objects
 * @param value raw value text on the first line (after {@code =})
 * @param line line of the assignment
 * @param endLine last line of the value
 * @param quotedName whether the name was written in double quotes
 * @param meta whether the name is a meta-argument (count, for_each, provider, depends_on, lifecycle)
 * @param shape syntactic shape
 * @param inline whether the parameter sits on the header line of a single-line block
 * @param entries nested entries of a collection literal
 */
public record Parameter(
    String name,
    String value,
    int line,
    int endLine,
    boolean quotedName,
    boolean meta,
    ParameterShape shape,
    boolean inline,
    List<Parameter> entries
) {
    /**
     * Terraform meta-argument names.
     */
    public static final Set<String> META_ARGUMENTS =
        Set.of("count", "for_each", "provider", "lifecycle", "depends_on");

    /**
     * Compact constructor with validation.
     */
    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        value = value == null ? "" : value;
        entries = entries == null ? List.of() : List.copyOf(entries);
        if (endLine < line) {
            throw new IllegalArgumentException("endLine " + endLine + " before line " + line + " for " + name);
        }
    }

    public boolean isAnonymous() {
        return name.isEmpty();
    }

    public boolean isMultiLine() {
        return endLine > line;
    }

    /**
     * Returns the width the name occupies in the source, counting quotes.
     *
     * @return visible name width
     */
    public int nameWidth() {
        return name.length() + (quotedName ? 2 : 0);
    }

    /**
     * Returns the value with surrounding double quotes removed.
     *
     * @return unquoted value text
     */
    public String unquotedValue() {
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
